package my.finresolver.app.lexicon;

/**
 * A lexicon keyword found in normalized text, with the label it stands for.
 */
public record LexiconMatch(String keyword, String label) {
}
