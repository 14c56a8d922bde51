package org.changeflow.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

/**
 * Binding for the {@code changeflow.*} properties.
 *
 * <pre>
 * changeflow:
 *   storage:
 *     schema: curation
 *     table-prefix: ds_
 *     staging-infix: _stg_
 *   validation:
 *     sample-size: 500
 *   decision:
 *     max-attempts: 3
 *   preview:
 *     max-rows: 500
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "changeflow")
public class ChangeflowProperties {

    @NestedConfigurationProperty
    private StorageConfig storage = new StorageConfig();

    @NestedConfigurationProperty
    private ValidationConfig validation = new ValidationConfig();

    @NestedConfigurationProperty
    private DecisionConfig decision = new DecisionConfig();

    @NestedConfigurationProperty
    private PreviewConfig preview = new PreviewConfig();

    @Data
    public static class StorageConfig {
        /** Schema that holds canonical and staging row tables. Blank means the connection default. */
        private String schema = "curation";
        private String tablePrefix = "ds_";
        private String stagingInfix = "_stg_";
    }

    @Data
    public static class ValidationConfig {
        /** Rows checked when a change request is opened. The full staged set is checked again at commit. */
        private int sampleSize = 500;
    }

    @Data
    public static class DecisionConfig {
        private int maxAttempts = 3;
    }

    @Data
    public static class PreviewConfig {
        private int maxRows = 500;
    }
}
