package alpha.nomagicbody.message;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A body together with the media type of its content, if known.
 *
 * @param body the body
 * @param type the media type
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record BodyWithType(Body body, Optional<String> type)
{
    /** The media type of extracted text. */
    public static final String TEXT_PLAIN_UTF_8 = "text/plain;charset=UTF-8";

    /**
     * Constructs a {@code BodyWithType}.
     *
     * @param body the body
     * @param type the media type
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    public BodyWithType {
        requireNonNull(body);
        requireNonNull(type);
    }

    /**
     * Extracts a body of unknown type from bytes.
     *
     * @param bytes content (copied)
     * @return a body with no type
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static BodyWithType extract(byte[] bytes) {
        return new BodyWithType(Body.of(bytes), Optional.empty());
    }

    /**
     * Extracts a UTF-8 encoded body from text.<p>
     *
     * The type is {@value #TEXT_PLAIN_UTF_8}.
     *
     * @param text content
     * @return a body with type
     *
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static BodyWithType extract(String text) {
        return new BodyWithType(Body.of(text.getBytes(UTF_8)), Optional.of(TEXT_PLAIN_UTF_8));
    }

    /**
     * Extracts a body from a blob.<p>
     *
     * The type is the blob's type, or unknown if the blob's type is empty.
     *
     * @param blob content
     * @return a body with type
     *
     * @throws NullPointerException if {@code blob} is {@code null}
     */
    public static BodyWithType extract(Blob blob) {
        var t = blob.type();
        return new BodyWithType(Body.of(blob), t.isEmpty() ? Optional.empty() : Optional.of(t));
    }

    /**
     * Returns the charset parameter of the type.<p>
     *
     * The parameter name is matched case-insensitively and the value may be
     * quoted. An empty optional is returned if there is no type, no charset
     * parameter, or the charset is not supported.
     *
     * @return the charset, if any
     */
    public Optional<Charset> charset() {
        return type.flatMap(BodyWithType::parseCharset);
    }

    private static Optional<Charset> parseCharset(String mediaType) {
        String[] tokens = mediaType.split(";");
        for (int i = 1; i < tokens.length; ++i) {
            String param = tokens[i].strip();
            int eq = param.indexOf('=');
            if (eq == -1 || !param.substring(0, eq).strip().equalsIgnoreCase("charset")) {
                continue;
            }
            String val = param.substring(eq + 1).strip();
            if (val.length() >= 2 && val.startsWith("\"") && val.endsWith("\"")) {
                val = val.substring(1, val.length() - 1);
            }
            try {
                return Optional.of(Charset.forName(val));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
