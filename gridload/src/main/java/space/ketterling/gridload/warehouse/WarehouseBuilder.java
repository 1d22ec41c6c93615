package space.ketterling.gridload.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;

import java.util.Map;

/**
 * Compacts history into segments and then re-points the views at them.
 * Calls are serialized so two rebuilds never write the same segment.
 */
public final class WarehouseBuilder {
    private static final Logger log = LoggerFactory.getLogger(WarehouseBuilder.class);

    private final WarehouseCompactor compactor;
    private final QueryFacade facade;

    public WarehouseBuilder(WarehouseCompactor compactor, QueryFacade facade) {
        this.compactor = compactor;
        this.facade = facade;
    }

    /**
     * @return rows written per dataset
     */
    public synchronized Map<Dataset, Integer> build() {
        long t0 = System.currentTimeMillis();
        Map<Dataset, Integer> rows = compactor.rebuild();
        facade.defineViews();
        log.info("Warehouse rebuilt in {} ms: {}", System.currentTimeMillis() - t0, rows);
        return rows;
    }
}
