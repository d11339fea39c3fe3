package io.syncbeat.mirror;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Paginated read access to a remote system of record.
 */
public interface RemoteSource {

    /**
     * Reads one page of records.
     *
     * @throws RemoteFetchException when the remote cannot be reached or rejects the call
     */
    List<Map<String, Object>> fetchPage(RemoteQuery query, int limit, int offset);

    int pageSize();

    /**
     * Lazily reads every record matching {@code query}, page by page, until a short page is returned.
     */
    default Stream<Map<String, Object>> fetchAll(RemoteQuery query) {
        return PagedFetch.stream(pageSize(), (limit, offset) -> fetchPage(query, limit, offset));
    }
}
