package com.tinqer.parser;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning query-construction lambda source into a generic
 * syntax tree.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>SLL-first, LL-fallback two-phase parsing for performance</li>
 *   <li>Positioned error messages via {@link LambdaErrorListener}</li>
 *   <li>Thread-safe via ThreadLocal parser pool</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   ArrowFunctionNode root = LambdaSourceParser.getInstance()
 *       .parseLambda("(q) => q.from(\"users\").where(u => u.age > 18)");
 * </pre>
 */
public class LambdaSourceParser {

    private static final Logger logger = LoggerFactory.getLogger(LambdaSourceParser.class);

    private static final ThreadLocal<LambdaSourceParser> PARSER_POOL =
        ThreadLocal.withInitial(LambdaSourceParser::new);

    private final LambdaLexer lexer;
    private final CommonTokenStream tokens;
    private final LambdaParser parser;

    public LambdaSourceParser() {
        this.lexer = new LambdaLexer(CharStreams.fromString(""));
        this.lexer.removeErrorListeners();
        this.lexer.addErrorListener(new LambdaErrorListener());
        this.tokens = new CommonTokenStream(lexer);
        this.parser = new LambdaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new LambdaErrorListener());
    }

    /**
     * Returns the thread-local parser instance.
     *
     * @return parser for the current thread
     */
    public static LambdaSourceParser getInstance() {
        return PARSER_POOL.get();
    }

    /**
     * Parses an expression (usually an arrow function) into a syntax tree.
     *
     * @param source the source text
     * @return the syntax tree
     * @throws ParseStructureException if the text is not valid lambda syntax
     */
    public AstNode parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ParseStructureException("Query source must not be null or empty", ErrorContext.method("parse"));
        }

        logger.debug("Parsing lambda source: {}", source);

        lexer.setInputStream(CharStreams.fromString(source));
        tokens.setTokenSource(lexer);
        parser.setTokenStream(tokens);

        // Phase 1: SLL
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        LambdaParser.ProgramContext tree;
        try {
            tree = parser.program();
        } catch (ParseStructureException e) {
            throw e;
        } catch (RuntimeException e) {
            // Phase 2: LL with full error reporting
            logger.debug("SLL parse failed, falling back to LL mode: {}", e.getMessage());
            tokens.seek(0);
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.removeErrorListeners();
            parser.addErrorListener(new LambdaErrorListener());
            parser.setErrorHandler(new DefaultErrorStrategy());

            tree = parser.program();
        }

        AstNode node = new LambdaAstBuilder().visit(tree);
        logger.debug("Parsed lambda source into {}", node.kind());
        return node;
    }

    /**
     * Parses source text that must be an arrow function.
     *
     * @param source the source text
     * @return the arrow function node
     * @throws ParseStructureException if the text is not an arrow function
     */
    public ArrowFunctionNode parseLambda(String source) {
        AstNode node = parse(source);
        if (node instanceof ArrowFunctionNode arrow) {
            return arrow;
        }
        throw new ParseStructureException(
            "Expected an arrow function but found " + node.kind(), ErrorContext.method("parse"));
    }
}
