package io.syncbeat.mirror;

import java.util.List;

/**
 * One remote resource read: model name, filter domain, field list and optional ordering.
 *
 * @param model  remote model, for example {@code res.partner}
 * @param domain filter triples, empty for "all records"
 * @param fields fields to read; {@code id} is always expected back
 * @param order  source-side ordering, or {@code null}
 */
public record RemoteQuery(String model, List<List<Object>> domain, List<String> fields, String order) {

    public RemoteQuery {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        domain = domain == null ? List.of() : List.copyOf(domain);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static RemoteQuery of(String model, List<String> fields) {
        return new RemoteQuery(model, List.of(), fields, null);
    }
}
