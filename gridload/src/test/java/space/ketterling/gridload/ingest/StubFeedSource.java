package space.ketterling.gridload.ingest;

import space.ketterling.gridload.TestPayloads;
import space.ketterling.gridload.isone.FeedSource;
import space.ketterling.gridload.isone.FetchedPayload;
import space.ketterling.gridload.isone.TransportException;
import space.ketterling.gridload.model.Dataset;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Serves fixture payloads per dataset, or fails with a configured transport
 * error. Every call is recorded.
 */
class StubFeedSource implements FeedSource {
    private final Map<Dataset, String> fixtures = new EnumMap<>(Dataset.class);
    private final Map<Dataset, TransportException> failures = new EnumMap<>(Dataset.class);
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    StubFeedSource serve(Dataset dataset, String fixture) {
        fixtures.put(dataset, fixture);
        failures.remove(dataset);
        return this;
    }

    StubFeedSource fail(Dataset dataset, TransportException e) {
        failures.put(dataset, e);
        return this;
    }

    @Override
    public FetchedPayload fetchCurrent(Dataset dataset) {
        calls.add(dataset.shortName() + "/current");
        return respond(dataset, "stub://" + dataset.shortName() + "/current.json");
    }

    @Override
    public FetchedPayload fetchDay(Dataset dataset, LocalDate day) {
        calls.add(dataset.shortName() + "/" + day);
        return respond(dataset, "stub://" + dataset.shortName() + "/day/" + day + ".json");
    }

    private FetchedPayload respond(Dataset dataset, String url) {
        TransportException e = failures.get(dataset);
        if (e != null)
            throw e;
        String fixture = fixtures.get(dataset);
        if (fixture == null)
            throw new TransportException(url, 404, "no fixture for " + dataset, null);
        return new FetchedPayload(url, TestPayloads.bytes(fixture), "application/json", TestPayloads.json(fixture));
    }
}
