package org.asymptote.compiler.frontend.parser;

import org.asymptote.compiler.frontend.parser.features.assign.AssignStatementHandler;
import org.asymptote.compiler.frontend.parser.features.call.CallStatementHandler;
import org.asymptote.compiler.frontend.parser.features.cond.IfStatementHandler;
import org.asymptote.compiler.frontend.parser.features.loop.ForStatementHandler;
import org.asymptote.compiler.frontend.parser.features.loop.RepeatStatementHandler;
import org.asymptote.compiler.frontend.parser.features.loop.WhileStatementHandler;
import org.asymptote.compiler.frontend.parser.features.ret.ReturnStatementHandler;
import org.asymptote.compiler.frontend.parser.features.routine.RoutineStatementHandler;
import org.asymptote.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers.
 * Maps the leading token type of a statement (e.g. FOR, IF, IDENTIFIER) to its handler.
 */
public class StatementHandlerRegistry {

    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a leading token type.
     * @param leading The token type that starts the statement.
     * @param handler The handler for this statement.
     */
    public void register(TokenType leading, IStatementHandler handler) {
        handlers.put(leading, handler);
    }

    /**
     * Looks up the handler for a leading token type.
     * @param leading The token type.
     * @return The handler, or empty if no statement starts with this token.
     */
    public Optional<IStatementHandler> get(TokenType leading) {
        return Optional.ofNullable(handlers.get(leading));
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.IDENTIFIER, new AssignStatementHandler());
        registry.register(TokenType.FOR, new ForStatementHandler());
        registry.register(TokenType.WHILE, new WhileStatementHandler());
        registry.register(TokenType.REPEAT, new RepeatStatementHandler());
        registry.register(TokenType.IF, new IfStatementHandler());
        registry.register(TokenType.CALL, new CallStatementHandler());
        registry.register(TokenType.RETURN, new ReturnStatementHandler());
        RoutineStatementHandler routine = new RoutineStatementHandler();
        registry.register(TokenType.FUNCTION, routine);
        registry.register(TokenType.PROCEDURE, routine);
        return registry;
    }
}
