package jobpulse.runner.util;

/**
 * Length caps for text persisted by the run ledger.
 */
public final class TextBounds {

    private TextBounds() {
    }

    /**
     * Cut {@code text} to at most {@code maxChars} characters without splitting
     * a surrogate pair. Null and empty stay null.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
