package FSM;

import java.util.ArrayList;
import java.util.List;

import FSM.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static FSM.Strings.symbols;

public class DFAConversionTest {
  @Test
  void testToCompactDFA() {
    CompactDFA<Symbol<Character>> dfa = DFAConversion.toCompactDFA(Fixtures.abc());
    Assertions.assertEquals(5, dfa.size()); // 4 states plus a sink for oblivion
    Assertions.assertEquals(0, dfa.getInitialState());
    Assertions.assertTrue(dfa.accepts(symbols("abc")));
    Assertions.assertFalse(dfa.accepts(symbols("ab")));
    Assertions.assertFalse(dfa.accepts(symbols("abca")));

    // complete tables need no sink
    CompactDFA<Symbol<Character>> div3 = DFAConversion.toCompactDFA(Fixtures.divisibleByThree());
    Assertions.assertEquals(6, div3.size());
    Assertions.assertTrue(div3.accepts(symbols("110")));
  }

  @Test
  void testFromDFA() {
    // binary strings with an odd number of 1s; state 2 is unreachable
    CompactDFA<Integer> myDFA = new CompactDFA<>(Alphabets.integers(0, 1));
    int even = myDFA.addInitialState(false);
    int odd = myDFA.addState(true);
    myDFA.addState(true);
    myDFA.setTransition(even, 0, even);
    myDFA.setTransition(even, 1, odd);
    myDFA.setTransition(odd, 0, odd);
    myDFA.setTransition(odd, 1, even);

    Automaton<Integer, Integer> parity = DFAConversion.fromDFA(myDFA, myDFA.getInputAlphabet());
    Assertions.assertEquals(2, parity.size());
    for (List<Integer> s : RandomAutomata.allStrings(RandomAutomata.BINARY, 6)) {
      Assertions.assertEquals(myDFA.accepts(s), parity.accepts(s), s.toString());
    }
  }

  @Test
  void testFromEmptyDFA() {
    CompactDFA<Integer> myDFA = new CompactDFA<>(Alphabets.integers(0, 1));
    Automaton<Integer, Integer> empty = DFAConversion.fromDFA(myDFA, myDFA.getInputAlphabet());
    Assertions.assertTrue(empty.isEmpty());
  }

  @Test
  void testExportThenImport() {
    for (int seed = 0; seed < 10; seed++) {
      Automaton<Integer, Integer> random = RandomAutomata.getRandomAutomaton(seed, 8);
      CompactDFA<Symbol<Integer>> exported = DFAConversion.toCompactDFA(random);
      // the imported automaton reads the exported symbols as its values
      Automaton<Integer, Symbol<Integer>> imported = DFAConversion.fromDFA(exported, exported.getInputAlphabet());
      Assertions.assertTrue(imported.size() <= exported.size());
      for (List<Integer> s : RandomAutomata.allStrings(RandomAutomata.BINARY, 6)) {
        List<Symbol<Integer>> symbols = new ArrayList<>(s.size());
        for (Integer value : s) {
          symbols.add(Symbol.of(value));
        }
        Assertions.assertEquals(random.accepts(s), imported.accepts(symbols), "seed " + seed + ", input " + s);
      }
    }
  }

  @Test
  void testAlgebraicIdentities() {
    for (int seed = 0; seed < 10; seed++) {
      Automaton<Integer, Integer> random = RandomAutomata.getRandomAutomaton(seed, 8);
      CompactDFA<Symbol<Integer>> reference = DFAConversion.toCompactDFA(random);
      Alphabet<Symbol<Integer>> alphabet = reference.getInputAlphabet();

      assertEquivalent(reference, Crawl.crawl(random), alphabet);
      assertEquivalent(reference, Operations.union(random, random), alphabet);
      assertEquivalent(reference, Operations.intersection(random, random), alphabet);
      assertEquivalent(reference, Operations.concatenate(Operations.epsilon(random.getAlphabet()), random), alphabet);
      assertEquivalent(reference, Operations.multiply(random, 1), alphabet);
      assertEquivalent(reference, Operations.union(random, Operations.nothing(random.getAlphabet())), alphabet);

      CompactDFA<Symbol<Integer>> starred = DFAConversion.toCompactDFA(Operations.star(random));
      assertEquivalent(starred, Operations.star(Operations.star(random)), alphabet);
      assertEquivalent(starred, Operations.concatenate(Operations.star(random), Operations.star(random)), alphabet);
    }
  }

  private static void assertEquivalent(CompactDFA<Symbol<Integer>> expected, Automaton<Integer, Integer> actual,
                                       Alphabet<Symbol<Integer>> alphabet) {
    CompactDFA<Symbol<Integer>> converted = DFAConversion.toCompactDFA(actual);
    Assertions.assertTrue(Automata.testEquivalence(expected, converted, alphabet));
  }
}
