package org.pragmatica.minipeg.parser;

import org.pragmatica.minipeg.error.ParseError;
import org.pragmatica.minipeg.error.ParseException;
import org.pragmatica.minipeg.grammar.Expression;
import org.pragmatica.minipeg.grammar.Grammar;
import org.pragmatica.minipeg.grammar.Rule;
import org.pragmatica.minipeg.tree.AstNode;
import org.pragmatica.minipeg.tree.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PEG parsing engine - interprets a Grammar against a ParseState.
 *
 * <p>The engine itself holds no per-parse state, so one instance may serve concurrent
 * parses over separate states.
 */
public final class PegEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(PegEngine.class);

    private final Grammar grammar;
    private final ParserConfig config;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(Objects.requireNonNull(grammar, "grammar"),
                             Objects.requireNonNull(config, "config"));
    }

    @Override
    public Grammar grammar() {
        return grammar;
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseOutcome parse(ParseState state) {
        var startRule = grammar.startRule()
                               .orElseThrow(() -> new ParseException(new ParseError.UndefinedRule("<start>")));
        return parse(state, startRule);
    }

    @Override
    public ParseOutcome parse(ParseState state, String startRule) {
        Objects.requireNonNull(state, "state");
        var rule = grammar.require(startRule);

        state.beginParse();
        var checkpoint = state.checkpoint();
        log.debug("Parsing {} from rule '{}'", state, startRule);

        var result = parseRule(state, rule);

        if (result instanceof ParseResult.Fatal fatal) {
            state.restore(checkpoint);
            log.debug("Parse aborted: {}", fatal.error().message());
            throw new ParseException(fatal.error());
        }

        if (result.isFailure()) {
            state.restore(checkpoint);
            var failure = (ParseResult.Failure) result;
            var position = Math.max(state.furthestPosition(), failure.position());
            var expected = state.furthestPosition() >= failure.position() && !state.furthestExpected().isEmpty()
                           ? state.furthestExpected()
                           : failure.expected();
            return noMatch(state, position, expected);
        }

        if (config.requireFullInput()) {
            grammar.whitespace().ifPresent(state::skip);
            if (!state.isAtEnd()) {
                var position = state.position();
                state.restore(checkpoint);
                return noMatch(state, position, "end of input");
            }
        }

        var root = state.lastNode()
                        .orElseThrow(() -> new IllegalStateException("Rule '" + startRule + "' produced no node"));
        log.debug("Parsed {} units with rule '{}'", state.position() - checkpoint.position(), startRule);
        return new ParseOutcome.Success(state, root);
    }

    private ParseOutcome noMatch(ParseState state, int position, String expected) {
        var error = new ParseError.NoMatch(position, state.describe(position), expected);
        log.debug("Parse failed: {}", error.message());
        return new ParseOutcome.Failure(error);
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParseState state, Rule rule) {
        var start = state.checkpoint();

        if (config.hasDepthLimit() && state.depth() >= config.maxDepth()) {
            return new ParseResult.Fatal(new ParseError.RecursionLimit(
                config.maxDepth(), rule.name(), start.position(), state.describe(start.position())));
        }

        var result = config.packratEnabled()
                     ? parseRuleMemoized(state, rule, start)
                     : parseRuleBody(state, rule, start);

        if (result instanceof ParseResult.Failure && rule.isRequired()) {
            return new ParseResult.Fatal(new ParseError.RuleFailed(
                rule.errorCode().orElseThrow(), Optional.of(rule.name()),
                start.position(), state.describe(start.position())));
        }
        return result;
    }

    private ParseResult parseRuleMemoized(ParseState state, Rule rule, ParseState.Checkpoint start) {
        var cached = state.memoAt(rule.name(), start.position());
        if (cached.isPresent()) {
            var memo = cached.get();
            if (!memo.matched()) {
                return ParseResult.Failure.at(start.position(), rule.name());
            }
            memo.node().ifPresent(state::push);
            state.setPosition(memo.end());
            return new ParseResult.Success(memo.end());
        }

        var result = parseRuleBody(state, rule, start);

        if (result.isSuccess()) {
            state.memoize(rule.name(), start.position(), new ParseState.Memo(true, state.position(), state.lastNode()));
        } else if (result instanceof ParseResult.Failure) {
            state.memoize(rule.name(), start.position(), new ParseState.Memo(false, start.position(), Optional.empty()));
        }
        return result;
    }

    private ParseResult parseRuleBody(ParseState state, Rule rule, ParseState.Checkpoint start) {
        if (log.isTraceEnabled()) {
            log.trace("Enter rule '{}' at {}", rule.name(), state.describe(start.position()));
        }

        ParseResult result;
        state.enterRule();
        try {
            result = evaluate(state, rule.expression());
        } finally {
            state.exitRule();
        }

        if (result.isSuccess()) {
            var children = state.takeFrom(start.astSize());
            state.push(group(rule.name(), children, Span.of(start.position(), state.position())));
        }

        if (log.isTraceEnabled()) {
            log.trace("Exit rule '{}': {}", rule.name(), result.isSuccess() ? "matched up to " + state.position() : "no match");
        }
        return result;
    }

    /**
     * A rule matching a single anonymous terminal becomes that terminal under the rule's name,
     * anything else becomes a non-terminal node holding the produced children.
     */
    private AstNode group(String ruleName, List<AstNode> children, Span span) {
        if (children.size() == 1 && children.get(0) instanceof AstNode.Terminal terminal && terminal.isAnonymous()) {
            return terminal.withRule(ruleName);
        }
        return new AstNode.NonTerminal(ruleName, children, span);
    }

    // === Expression Parsing ===

    /**
     * Evaluate an expression, restoring the state if it does not match.
     */
    private ParseResult evaluate(ParseState state, Expression expr) {
        var checkpoint = state.checkpoint();
        var result = dispatch(state, expr);
        if (result.isFailure()) {
            state.restore(checkpoint);
        }
        return result;
    }

    private ParseResult dispatch(ParseState state, Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return parseTerminal(state, "'" + lit.text() + "'", () -> state.matchLiteral(lit.text()));
        } else if (expr instanceof Expression.Regex regex) {
            return parseTerminal(state, "/" + regex.pattern().pattern() + "/", () -> state.matchRegex(regex.pattern()));
        } else if (expr instanceof Expression.Predicate predicate) {
            return parseTerminal(state, predicate.description(), () -> state.matchUnit(predicate.test()));
        } else if (expr instanceof Expression.Reference ref) {
            return parseReference(state, ref);
        } else if (expr instanceof Expression.Sequence seq) {
            return parseSequence(state, seq);
        } else if (expr instanceof Expression.Choice choice) {
            return parseChoice(state, choice);
        } else if (expr instanceof Expression.Optional opt) {
            return parseOptional(state, opt);
        } else if (expr instanceof Expression.Repetition rep) {
            return parseRepetition(state, rep);
        } else if (expr instanceof Expression.Required req) {
            return parseRequired(state, req);
        } else if (expr instanceof Expression.Ignore ign) {
            return parseIgnore(state, ign);
        }
        throw new IllegalStateException("Unknown expression type: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseTerminal(ParseState state, String expected, Supplier<Optional<String>> matcher) {
        grammar.whitespace().ifPresent(state::skip);
        var start = state.position();
        var matched = matcher.get();
        if (matched.isEmpty()) {
            state.updateFurthest(expected);
            return ParseResult.Failure.at(start, expected);
        }
        state.push(AstNode.Terminal.anonymous(matched.get(), Span.of(start, state.position())));
        return new ParseResult.Success(state.position());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParseState state, Expression.Reference ref) {
        var rule = grammar.rule(ref.ruleName());
        if (rule.isEmpty()) {
            return new ParseResult.Fatal(new ParseError.UndefinedRule(ref.ruleName()));
        }
        return parseRule(state, rule.get());
    }

    private ParseResult parseSequence(ParseState state, Expression.Sequence seq) {
        for (var element : seq.elements()) {
            var result = evaluate(state, element);
            if (result.isFailure()) {
                return result;
            }
        }
        return new ParseResult.Success(state.position());
    }

    private ParseResult parseChoice(ParseState state, Expression.Choice choice) {
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            var result = evaluate(state, alt);
            if (result.isSuccess() || result instanceof ParseResult.Fatal) {
                return result;
            }
            lastFailure = result;
        }
        return lastFailure;
    }

    private ParseResult parseOptional(ParseState state, Expression.Optional opt) {
        var result = evaluate(state, opt.expression());
        if (result instanceof ParseResult.Fatal) {
            return result;
        }
        return new ParseResult.Success(state.position());
    }

    private ParseResult parseRepetition(ParseState state, Expression.Repetition rep) {
        var start = state.position();
        int count = 0;

        while (true) {
            var before = state.position();
            var result = evaluate(state, rep.expression());
            if (result instanceof ParseResult.Fatal) {
                return result;
            }
            if (result.isFailure()) {
                break;
            }
            count++;
            // A match that consumed nothing would repeat forever
            if (state.position() == before) {
                count = Math.max(count, rep.min());
                break;
            }
        }

        if (count < rep.min()) {
            return ParseResult.Failure.at(start, "at least " + rep.min() + " repetitions");
        }
        return new ParseResult.Success(state.position());
    }

    // === Special Parsers ===

    private ParseResult parseRequired(ParseState state, Expression.Required req) {
        var start = state.position();
        var result = evaluate(state, req.expression());
        if (result instanceof ParseResult.Failure) {
            return new ParseResult.Fatal(new ParseError.RuleFailed(
                req.errorCode(), Optional.empty(), start, state.describe(start)));
        }
        return result;
    }

    private ParseResult parseIgnore(ParseState state, Expression.Ignore ign) {
        var checkpoint = state.checkpoint();
        var result = evaluate(state, ign.expression());
        if (result.isSuccess()) {
            state.truncate(checkpoint.astSize());
        }
        return result;
    }
}
