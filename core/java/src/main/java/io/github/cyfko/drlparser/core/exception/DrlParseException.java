package io.github.cyfko.drlparser.core.exception;

/**
 * Signals that parsing cannot proceed at all.
 * <p>
 * This exception never reaches callers of
 * {@link io.github.cyfko.drlparser.core.api.DrlParser#parse(String)}: the parser converts it into a
 * single {@code Critical parsing error} diagnostic and substitutes an empty tree. It is public so
 * that code driving the internal parsing components directly can tell a refused document apart from
 * a programming error.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>Document larger than {@code ParserPolicy#maxDocumentLength()}</li>
 *   <li>Missing document text</li>
 * </ul>
 *
 * @since 1.0
 */
public class DrlParseException extends RuntimeException {

    /**
     * @param message the message describing why parsing was refused
     */
    public DrlParseException(String message) {
        super(message);
    }
}
