package org.netpreserve.trawler.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * A successful response.
 *
 * @param url         the URL that was requested
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header, if any
 * @param body        response body
 */
public record FetchResult(Url url, int status, @Nullable String contentType, byte[] body) {

    /**
     * Content type without parameters, lowercased. Empty if the server didn't send one.
     */
    public String mediaType() {
        if (contentType == null) return "";
        int semicolon = contentType.indexOf(';');
        String type = semicolon == -1 ? contentType : contentType.substring(0, semicolon);
        return type.strip().toLowerCase(Locale.ROOT);
    }

    public Charset charset() {
        if (contentType != null) {
            for (String param : contentType.split(";")) {
                param = param.strip();
                if (param.regionMatches(true, 0, "charset=", 0, 8)) {
                    String name = param.substring(8).replace("\"", "").strip();
                    try {
                        return Charset.forName(name);
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        break;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    public String text() {
        return new String(body, charset());
    }
}
