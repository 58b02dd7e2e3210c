package FSM;

import java.util.List;
import java.util.Map;

import FSM.Model.Symbol;

import static FSM.Strings.symbols;

/**
 * Small literal automata over characters, shared by the tests.
 */
public class Fixtures {
    static final Symbol<Character> A = Symbol.of('a');
    static final Symbol<Character> B = Symbol.of('b');
    static final Symbol<Character> C = Symbol.of('c');

    /**
     * Accepts "a" only; "ob" is an explicit (ordinary) dead state.
     */
    static Automaton<String, Character> a() {
        return Automaton.build(symbols("ab"), List.of("0", "1", "ob"), "0", List.of("1"), Map.of(
            "0", Map.of(A, "1", B, "ob"),
            "1", Map.of(A, "ob", B, "ob"),
            "ob", Map.of(A, "ob", B, "ob")));
    }

    /**
     * Accepts "b" only.
     */
    static Automaton<String, Character> b() {
        return Automaton.build(symbols("ab"), List.of("0", "1", "ob"), "0", List.of("1"), Map.of(
            "0", Map.of(A, "ob", B, "1"),
            "1", Map.of(A, "ob", B, "ob"),
            "ob", Map.of(A, "ob", B, "ob")));
    }

    /**
     * Accepts "abc" only, with a sparse table.
     */
    static Automaton<String, Character> abc() {
        return Automaton.build(symbols("abc"), List.of("0", "1", "2", "3"), "0", List.of("3"), Map.of(
            "0", Map.of(A, "1"),
            "1", Map.of(B, "2"),
            "2", Map.of(C, "3")));
    }

    /**
     * a*ba
     */
    static Automaton<String, Character> aStarBA() {
        return Automaton.build(symbols("ab"), List.of("0", "1", "2"), "0", List.of("2"), Map.of(
            "0", Map.of(A, "0", B, "1"),
            "1", Map.of(A, "2")));
    }

    /**
     * Binary numerals divisible by 3, without leading zeroes. Rejects the empty string.
     */
    static Automaton<String, Character> divisibleByThree() {
        final Symbol<Character> zero = Symbol.of('0');
        final Symbol<Character> one = Symbol.of('1');
        return Automaton.build(symbols("01"),
            List.of("initial", "zero", "s0", "s1", "s2", "oblivion"),
            "initial",
            List.of("zero", "s0"),
            Map.of(
                "initial", Map.of(zero, "zero", one, "s1"),
                "zero", Map.of(zero, "oblivion", one, "oblivion"),
                "s0", Map.of(zero, "s0", one, "s1"),
                "s1", Map.of(zero, "s2", one, "s0"),
                "s2", Map.of(zero, "s1", one, "s2"),
                "oblivion", Map.of(zero, "oblivion", one, "oblivion")));
    }
}
