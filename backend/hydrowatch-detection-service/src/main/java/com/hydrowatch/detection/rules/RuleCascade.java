package com.hydrowatch.detection.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered list of (predicate, outcome) pairs evaluated top to bottom; the first matching rule
 * wins. An optional fallback supplies the outcome when nothing matches.
 *
 * @param <I> input inspected by the predicates
 * @param <O> outcome produced by the matching rule
 */
public final class RuleCascade<I, O> {

  public record Rule<I, O>(String name, Predicate<I> when, Function<I, O> then) {}

  private final List<Rule<I, O>> rules;
  private final Function<I, O> fallback;

  private RuleCascade(List<Rule<I, O>> rules, Function<I, O> fallback) {
    this.rules = List.copyOf(rules);
    this.fallback = fallback;
  }

  public static <I, O> Builder<I, O> builder() {
    return new Builder<>();
  }

  /** First matching rule, ignoring the fallback. */
  public Optional<Rule<I, O>> firstMatch(I input) {
    for (Rule<I, O> rule : rules) {
      if (rule.when().test(input)) return Optional.of(rule);
    }
    return Optional.empty();
  }

  /** Outcome of the first matching rule, without consulting the fallback. */
  public Optional<O> match(I input) {
    return firstMatch(input).map(rule -> rule.then().apply(input));
  }

  /**
   * Outcome of the first matching rule, or of the fallback.
   *
   * @throws IllegalStateException when nothing matches and no fallback was configured
   */
  public O evaluate(I input) {
    Optional<Rule<I, O>> rule = firstMatch(input);
    if (rule.isPresent()) return rule.get().then().apply(input);
    if (fallback == null) {
      throw new IllegalStateException("No rule matched and no fallback configured");
    }
    return fallback.apply(input);
  }

  public List<String> ruleNames() {
    return rules.stream().map(Rule::name).toList();
  }

  public static final class Builder<I, O> {
    private final List<Rule<I, O>> rules = new ArrayList<>();
    private Function<I, O> fallback;

    public Builder<I, O> when(String name, Predicate<I> predicate, Function<I, O> outcome) {
      rules.add(new Rule<>(name, predicate, outcome));
      return this;
    }

    public Builder<I, O> when(String name, Predicate<I> predicate, O outcome) {
      return when(name, predicate, in -> outcome);
    }

    public Builder<I, O> otherwise(Function<I, O> outcome) {
      this.fallback = outcome;
      return this;
    }

    public Builder<I, O> otherwise(O outcome) {
      return otherwise(in -> outcome);
    }

    public RuleCascade<I, O> build() {
      return new RuleCascade<>(rules, fallback);
    }
  }
}
