package orderbookService;

import com.google.gson.JsonObject;

/**
 * One line of the write-ahead log.
 *
 * @param seq     sequence number assigned by the log, starting at 1
 * @param ts      append time in epoch milliseconds
 * @param type    event kind
 * @param payload event body; decode with {@link #payloadAs(Class)}
 */
public record WalEntry(long seq, long ts, WalEntryType type, JsonObject payload) {

    public <T> T payloadAs(Class<T> payloadType) {
        if (payload == null) {
            throw new IllegalArgumentException("WAL entry " + seq + " has no payload");
        }
        T decoded = Json.GSON.fromJson(payload, payloadType);
        if (decoded == null) {
            throw new IllegalArgumentException("WAL entry " + seq + " has an empty payload");
        }
        return decoded;
    }
}
