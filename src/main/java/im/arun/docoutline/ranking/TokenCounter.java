package im.arun.docoutline.ranking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counting and truncation using JTokkit's cl100k_base encoding, which the
 * OpenAI embedding models share.
 */
public class TokenCounter {
    private final Encoding encoding;

    public TokenCounter() {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    /**
     * Cuts the text to at most {@code maxTokens} tokens. Text already within the limit is returned as is.
     */
    public String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        EncodingResult result = encoding.encode(text, maxTokens);
        if (!result.isTruncated()) {
            return text;
        }
        return encoding.decode(result.getTokens());
    }
}
