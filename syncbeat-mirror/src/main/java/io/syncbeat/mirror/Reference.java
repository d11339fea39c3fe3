package io.syncbeat.mirror;

/**
 * A many-to-one value as the remote encodes it: {@code [id, label]}.
 * Both parts are {@code null} when the remote sends {@code false}.
 */
public record Reference(Long id, String label) {

    public static final Reference NONE = new Reference(null, null);
}
