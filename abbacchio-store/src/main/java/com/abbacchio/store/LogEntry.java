package com.abbacchio.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stored log line.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogEntry {

    private String id;
    /** Numeric pino-style level (10 trace … 60 fatal). */
    private int level;
    private String levelLabel;
    /** Epoch millis. */
    private long time;
    private String msg;
    private String namespace;
    private String channel;
    /** Every field of the incoming record that is not one of the above. */
    private ObjectNode data;
    private boolean encrypted;
    /** Opaque ciphertext, only set on encrypted entries. */
    private String encryptedData;
}
