package org.sfc.verification.sfc.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A transition as written in a model file.
 * {@code src} and {@code tgt} are either a single step name or an array of names:
 * <pre>
 * {"src": "Check", "tgt": "Multiply", "guard": "i &lt;= n"}
 * {"src": ["A", "B"], "tgt": "Join", "guard": "true"}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransitionEntry {
    @JsonFormat(with = {JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY,
            JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED})
    public List<String> src;

    @JsonFormat(with = {JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY,
            JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED})
    public List<String> tgt;

    public String guard;
}
