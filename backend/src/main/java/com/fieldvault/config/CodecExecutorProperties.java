package com.fieldvault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Worker pool for batch encode/decode.
 */
@ConfigurationProperties(prefix = "fieldvault.codec")
public record CodecExecutorProperties(

    /** 0 means one thread per available processor. */
    @DefaultValue("0") int poolSize,

    @DefaultValue("1000") int queueCapacity

) {

    public int effectivePoolSize() {
        return poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
    }
}
