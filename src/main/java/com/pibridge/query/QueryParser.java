package com.pibridge.query;

import com.pibridge.query.parser.PiSqlLexer;
import com.pibridge.query.parser.PiSqlParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Parses the restricted SQL dialect used by historian triggers into a {@link ParsedQuery}.
 */
@Component
public class QueryParser {

    private static final Logger log = LoggerFactory.getLogger(QueryParser.class);

    private static final Pattern MINIMAL_SHAPE = Pattern.compile(
        "^\\s*SELECT\\b.*?\\bFROM\\s+[A-Za-z_]", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /**
     * Parse a declarative query.
     *
     * @param text query text starting with SELECT
     * @return the extracted tag, limit, predicates, legacy range and ORDER BY column
     * @throws QueryParseException if the text is not {@code SELECT ... FROM <table>} or
     *                             does not follow the grammar
     */
    public ParsedQuery parse(String text) {
        if (text == null || !MINIMAL_SHAPE.matcher(text).find()) {
            throw new QueryParseException("Query must have the form SELECT ... FROM <table>", text);
        }

        SyntaxErrorListener errors = new SyntaxErrorListener(text);

        PiSqlLexer lexer = new PiSqlLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        PiSqlParser parser = new PiSqlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ParseTree tree = parser.query();

        ParsedQuery parsed = new PiSqlVisitor().visit(tree);
        parsed.setText(text);
        log.debug("Parsed query: {}", parsed);
        return parsed;
    }

    /**
     * Fails the parse on the first lexer or parser error.
     */
    private static final class SyntaxErrorListener extends BaseErrorListener {

        private final String text;

        SyntaxErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new QueryParseException(
                String.format("Syntax error at %d:%d: %s", line, charPositionInLine, msg), text, e);
        }
    }
}
