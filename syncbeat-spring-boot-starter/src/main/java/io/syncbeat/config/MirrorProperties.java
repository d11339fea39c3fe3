package io.syncbeat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local mirror settings.
 */
@ConfigurationProperties(prefix = "syncbeat.mirror")
public class MirrorProperties {
    private boolean initializeSchema = false;
    // when false an empty remote snapshot is treated as a remote glitch and ignored
    private boolean allowEmptySnapshot = false;

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public boolean isAllowEmptySnapshot() {
        return allowEmptySnapshot;
    }

    public void setAllowEmptySnapshot(boolean allowEmptySnapshot) {
        this.allowEmptySnapshot = allowEmptySnapshot;
    }
}
