package io.contextrunr.context;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a message refers back to a previously shared image.
 *
 * <p>A message is an image reference when it names an image explicitly ("gambar", "foto",
 * "picture"), when it combines a temporal reference ("tadi", "earlier") with a demonstrative
 * ("itu", "this"), or when it is a question containing a demonstrative.</p>
 */
@Component
public class ImageReferenceDetector {

    private static final int MIN_QUESTION_LENGTH = 4;

    static final List<String> IMAGE_KEYWORDS = List.of(
            "gambar", "foto", "fotonya", "gambarnya", "isi gambar", "isi fotonya", "apa ini",
            "analisa gambar", "analisis gambar", "jelaskan gambar", "jelasin gambar",
            "apa yang terlihat", "image", "picture", "photo", "pic");

    static final List<String> TEMPORAL_REFERENCES = List.of(
            "tadi", "sebelumnya", "sebelum ini", "yang tadi", "yang sebelumnya", "yang barusan",
            "earlier", "before", "previous", "just now", "just shared", "just sent",
            "yang kamu kirim", "yang dikirim", "yang dishare", "yang dibagikan");

    static final List<String> DEMONSTRATIVES = List.of(
            "ini", "itu", "tersebut", "this", "that", "those", "these");

    static final List<String> QUESTION_WORDS = List.of(
            "apa", "siapa", "kapan", "dimana", "gimana", "bagaimana", "kenapa", "mengapa", "tolong");

    private static final Pattern KEYWORD = anyWord(IMAGE_KEYWORDS);
    private static final Pattern TEMPORAL = anyWord(TEMPORAL_REFERENCES);
    private static final Pattern DEMONSTRATIVE = anyWord(DEMONSTRATIVES);
    private static final Pattern QUESTION = anyWord(QUESTION_WORDS);

    public boolean isImageReference(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT).trim();

        if (KEYWORD.matcher(lower).find()) {
            return true;
        }
        boolean demonstrative = DEMONSTRATIVE.matcher(lower).find();
        if (demonstrative && TEMPORAL.matcher(lower).find()) {
            return true;
        }
        boolean question = lower.endsWith("?") || QUESTION.matcher(lower).find();
        return lower.length() >= MIN_QUESTION_LENGTH && question && demonstrative;
    }

    private static Pattern anyWord(List<String> phrases) {
        StringBuilder regex = new StringBuilder("\\b(?:");
        for (int i = 0; i < phrases.size(); i++) {
            if (i > 0) regex.append('|');
            regex.append(Pattern.quote(phrases.get(i)));
        }
        return Pattern.compile(regex.append(")\\b").toString());
    }
}
