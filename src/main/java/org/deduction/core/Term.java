package org.deduction.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 一阶项：一个小写标识符 (常元或变元)，或作用于若干参数项的函数项，如 f(a,x)。
 * 常元与变元在语法上不区分，是否受约束由外层量词决定。
 * 此类是不可变的。
 */
@Getter
public final class Term implements Comparable<Term> {

    private final String name;
    private final List<Term> arguments;

    private final int hashCode;

    private Term(String name, List<Term> arguments) {
        Objects.requireNonNull(name, "Term name cannot be null.");
        Objects.requireNonNull(arguments, "Term arguments cannot be null.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Term name cannot be empty.");
        }
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.hashCode = Objects.hash(name, this.arguments);
    }

    public static Term of(String name) {
        return new Term(name, Collections.emptyList());
    }

    public static Term of(String name, List<Term> arguments) {
        return new Term(name, arguments);
    }

    public boolean isCompound() {
        return !arguments.isEmpty();
    }

    /**
     * 收集此项中出现的全部叶子标识符 (函数符号本身不计入)。
     */
    public Set<String> names() {
        Set<String> result = new TreeSet<>();
        collectNames(result);
        return result;
    }

    private void collectNames(Set<String> acc) {
        if (arguments.isEmpty()) {
            acc.add(name);
            return;
        }
        for (Term argument : arguments) {
            argument.collectNames(acc);
        }
    }

    public boolean mentions(String identifier) {
        if (arguments.isEmpty()) {
            return name.equals(identifier);
        }
        for (Term argument : arguments) {
            if (argument.mentions(identifier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 将叶子标识符 variable 替换为 replacement。
     */
    public Term substitute(String variable, Term replacement) {
        if (arguments.isEmpty()) {
            return name.equals(variable) ? replacement : this;
        }
        List<Term> replaced = arguments.stream()
                .map(a -> a.substitute(variable, replacement))
                .toList();
        return replaced.equals(arguments) ? this : new Term(name, replaced);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Term term = (Term) o;
        return name.equals(term.name) && arguments.equals(term.arguments);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    public int compareTo(Term other) {
        return toString().compareTo(other.toString());
    }
}
