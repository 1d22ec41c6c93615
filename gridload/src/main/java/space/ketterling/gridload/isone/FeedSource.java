package space.ketterling.gridload.isone;

import space.ketterling.gridload.model.Dataset;

import java.time.LocalDate;

/**
 * Where raw payloads come from.
 */
public interface FeedSource {

    /**
     * Payload for the current interval of a dataset.
     *
     * @throws TransportException on any HTTP, content-type or JSON failure
     */
    FetchedPayload fetchCurrent(Dataset dataset);

    /**
     * Payload for one full (market) day.
     *
     * @throws TransportException on any HTTP, content-type or JSON failure
     */
    FetchedPayload fetchDay(Dataset dataset, LocalDate day);
}
