package com.eventwatch.core.exception;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Maps a downstream failure to a {@link SecurityExceptionKind}, or to nothing
 * when the failure is not security-relevant.
 *
 * <p>
 * Rules are an explicit ordered list; the first one that accepts the
 * throwable wins. The thrown type is classified first. Only registered
 * container wrappers are looked through to their cause, so a controller's
 * exception is classified the same whether or not the container wrapped it,
 * while an application exception that merely carries a cause is judged on its
 * own type.
 * </p>
 */
public final class SecurityExceptionClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private final List<Rule> rules;
    private final List<Class<? extends Throwable>> wrapperTypes;

    private SecurityExceptionClassifier(List<Rule> rules, List<Class<? extends Throwable>> wrapperTypes) {
        this.rules = List.copyOf(rules);
        this.wrapperTypes = List.copyOf(wrapperTypes);
    }

    /** Classifier with the built-in JDK rules and wrappers only. */
    public static SecurityExceptionClassifier defaults() {
        return builder().withDefaults().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SecurityExceptionKind> classify(Throwable failure) {
        Rule rule = findRule(failure);
        return rule != null ? Optional.of(rule.kind) : Optional.empty();
    }

    /**
     * The throwable that {@link #classify} matched, used to name the exception
     * type in event details. Falls back to {@code failure}.
     */
    public Throwable findClassifiedCause(Throwable failure) {
        Throwable matched = findMatch(failure);
        return matched != null ? matched : failure;
    }

    private Rule findRule(Throwable failure) {
        Throwable matched = findMatch(failure);
        return matched != null ? matchingRule(matched) : null;
    }

    private Throwable findMatch(Throwable failure) {
        Throwable current = failure;
        Set<Throwable> visited = new HashSet<>();
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH && visited.add(current); depth++) {
            if (matchingRule(current) != null) {
                return current;
            }
            if (!isWrapper(current)) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    private boolean isWrapper(Throwable throwable) {
        for (Class<? extends Throwable> type : wrapperTypes) {
            if (type.isInstance(throwable)) {
                return true;
            }
        }
        return false;
    }

    private Rule matchingRule(Throwable throwable) {
        for (Rule rule : rules) {
            if (rule.predicate.test(throwable)) {
                return rule;
            }
        }
        return null;
    }

    private static final class Rule {
        final SecurityExceptionKind kind;
        final Predicate<Throwable> predicate;

        Rule(SecurityExceptionKind kind, Predicate<Throwable> predicate) {
            this.kind = kind;
            this.predicate = predicate;
        }
    }

    public static class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private final List<Class<? extends Throwable>> wrapperTypes = new ArrayList<>();

        /**
         * {@link SecurityException} and its subclasses are violations; a bare
         * {@link IllegalStateException} (not its subclasses) is an invalid
         * operation. {@link IllegalArgumentException} is deliberately absent.
         * The JDK's reflective and concurrent wrappers are looked through.
         */
        public Builder withDefaults() {
            rule(SecurityExceptionKind.SECURITY_VIOLATION, t -> t instanceof SecurityException);
            rule(SecurityExceptionKind.INVALID_OPERATION, t -> t.getClass() == IllegalStateException.class);
            wrapper(UndeclaredThrowableException.class);
            wrapper(InvocationTargetException.class);
            wrapper(CompletionException.class);
            wrapper(ExecutionException.class);
            return this;
        }

        /** Failures of {@code type} that match no rule are classified by their cause. */
        public Builder wrapper(Class<? extends Throwable> type) {
            wrapperTypes.add(Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder rule(SecurityExceptionKind kind, Predicate<Throwable> predicate) {
            rules.add(new Rule(Objects.requireNonNull(kind, "kind"),
                    Objects.requireNonNull(predicate, "predicate")));
            return this;
        }

        /** Classifies {@code type} and its subclasses as {@code kind}. */
        public Builder rule(SecurityExceptionKind kind, Class<? extends Throwable> type) {
            Objects.requireNonNull(type, "type");
            return rule(kind, type::isInstance);
        }

        public SecurityExceptionClassifier build() {
            return new SecurityExceptionClassifier(rules, wrapperTypes);
        }
    }
}
