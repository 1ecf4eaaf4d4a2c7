package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A block of a kind this library does not know. All fields are kept so that it can be written back unchanged.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class UnknownDisplayBlock extends DisplayBlock {
    private final Map<String, Object> data = new LinkedHashMap<>();

    @JsonCreator
    public UnknownDisplayBlock(@JsonProperty("type") String type) {
        super(type);
    }

    public UnknownDisplayBlock(String type, Map<String, Object> data) {
        super(type);
        this.data.putAll(data);
    }

    @JsonAnySetter
    public void put(String key, Object value) {
        data.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }
}
