package org.pragmatica.minipeg.grammar;

import org.pragmatica.minipeg.error.ParseError;
import org.pragmatica.minipeg.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A PEG grammar - registry of named rules.
 *
 * <p>Rules may reference rules that are defined later; references are resolved by name
 * when the parser reaches them. Defining a name twice replaces the earlier rule, while
 * the rule keeps its original place in definition order.
 *
 * <p>Not thread-safe for mutation. Once all rules are defined the grammar may be shared
 * by any number of concurrent parses, provided nobody calls {@link #define} meanwhile.
 */
public final class Grammar {
    private static final Logger log = LoggerFactory.getLogger(Grammar.class);

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private String startRule;
    private Pattern whitespace;

    private Grammar() {}

    public static Grammar create() {
        return new Grammar();
    }

    // === Definition ===

    /**
     * Register a rule, replacing any rule already registered under {@code name}.
     */
    public Grammar define(String name, Expression expression) {
        return define(Rule.rule(name, expression));
    }

    /**
     * Register a rule whose failure aborts the parse with {@code errorCode}.
     */
    public Grammar defineRequired(String name, Expression expression, String errorCode) {
        return define(Rule.required(name, expression, errorCode));
    }

    public Grammar define(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        if (rules.put(rule.name(), rule) != null) {
            log.debug("Rule '{}' redefined, previous definition replaced", rule.name());
        }
        return this;
    }

    /**
     * Use {@code name} as the start rule instead of the first defined one.
     */
    public Grammar startWith(String name) {
        this.startRule = Objects.requireNonNull(name, "name");
        return this;
    }

    /**
     * Skip input matching {@code pattern} before every text terminal.
     */
    public Grammar whitespace(String pattern) {
        return whitespace(Pattern.compile(pattern));
    }

    public Grammar whitespace(Pattern pattern) {
        this.whitespace = Objects.requireNonNull(pattern, "pattern");
        return this;
    }

    // === Lookup ===

    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * Get rule by name, failing with {@link ParseError.UndefinedRule} if it was never defined.
     */
    public Rule require(String name) {
        var rule = rules.get(name);
        if (rule == null) {
            throw new ParseException(new ParseError.UndefinedRule(name));
        }
        return rule;
    }

    /**
     * Name of the rule parsing starts from: explicit start rule or the first defined one.
     */
    public Optional<String> startRule() {
        if (startRule != null) {
            return Optional.of(startRule);
        }
        return rules.keySet()
                    .stream()
                    .findFirst();
    }

    public Optional<Pattern> whitespace() {
        return Optional.ofNullable(whitespace);
    }

    public List<String> ruleNames() {
        return List.copyOf(rules.keySet());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    // === Validation ===

    /**
     * Names referenced by some rule but never defined, in order of first appearance.
     * Parsing does not require this check; an undefined reference fails only when reached.
     */
    public Set<String> undefinedReferences() {
        var undefined = new LinkedHashSet<String>();
        for (var rule : rules.values()) {
            collectUndefined(rule.expression(), undefined);
        }
        return undefined;
    }

    private void collectUndefined(Expression expr, Set<String> undefined) {
        if (expr instanceof Expression.Reference ref) {
            if (!rules.containsKey(ref.ruleName())) {
                undefined.add(ref.ruleName());
            }
        } else if (expr instanceof Expression.Sequence seq) {
            seq.elements().forEach(e -> collectUndefined(e, undefined));
        } else if (expr instanceof Expression.Choice choice) {
            choice.alternatives().forEach(e -> collectUndefined(e, undefined));
        } else if (expr instanceof Expression.Optional opt) {
            collectUndefined(opt.expression(), undefined);
        } else if (expr instanceof Expression.Repetition rep) {
            collectUndefined(rep.expression(), undefined);
        } else if (expr instanceof Expression.Required req) {
            collectUndefined(req.expression(), undefined);
        } else if (expr instanceof Expression.Ignore ign) {
            collectUndefined(ign.expression(), undefined);
        }
        // Terminals - no nested expressions
    }

    @Override
    public String toString() {
        return "Grammar" + rules.keySet();
    }
}
