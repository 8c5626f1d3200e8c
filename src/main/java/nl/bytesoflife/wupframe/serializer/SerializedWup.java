package nl.bytesoflife.wupframe.serializer;

/**
 * Serializer output. {@code text} is null when no statement survived; {@code fallback} then
 * holds the original source text, or an empty string when there is none.
 */
public record SerializedWup(String text, String fallback) {

    public boolean isEmpty() {
        return text == null;
    }

    /**
     * What to write: the text, else the fallback.
     */
    public String payload() {
        if (text != null) return text;
        return fallback != null ? fallback : "";
    }
}
