package com.fieldvault.document;

import java.io.Serializable;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

@PrimaryKeyClass
public record DocumentKey(
    @PrimaryKeyColumn(name = "collection", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String collection,

    @PrimaryKeyColumn(name = "id", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    String id
) implements Serializable {}
