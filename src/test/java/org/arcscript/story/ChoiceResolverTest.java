/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcscript.story;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.arcscript.Arcscript;
import org.arcscript.ErrorType;
import org.arcscript.Value;
import org.junit.Before;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Choice resolution through branches and jumpers
 * <pre>
 * start --c1 "Fallback"--&gt; br1 --x &gt; 5--c2--------&gt; high
 *                                --x &gt; 0--c3 "Go"---&gt; low
 *                                --else---c4--------&gt; none
 * start --c5 "Leap"--&gt; j1 ====&gt; far
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ChoiceResolverTest {
	private Arcscript arcscript;
	private MapStoryGraph graph;
	private ChoiceResolver resolver;

	private static List<String> ids (String... ids) {
		return Arrays.asList (ids);
	}

	private static Element element (String id, String... outputs) {
		return new Element (id, id, "", ids (outputs));
	}

	@Before
	public void setUp () {
		arcscript = new Arcscript ();
		arcscript.variableDeclare ("x", Value.of (1));

		graph = new MapStoryGraph ()
			.elementAdd (element ("start", "c1", "c5"))
			.elementAdd (element ("high"))
			.elementAdd (element ("low"))
			.elementAdd (element ("none"))
			.elementAdd (element ("far"))
			.connectionAdd (new Connection ("c1", "Fallback", "start", "br1"))
			.connectionAdd (new Connection ("c2", "", "k1", "high"))
			.connectionAdd (new Connection ("c3", "Go", "k2", "low"))
			.connectionAdd (new Connection ("c4", null, "k3", "none"))
			.connectionAdd (new Connection ("c5", "Leap", "start", "j1"))
			.conditionAdd (new Condition ("k1", "x > 5", "c2"))
			.conditionAdd (new Condition ("k2", "x > 0", "c3"))
			.conditionAdd (new Condition ("k3", null, "c4"))
			.branchAdd (new Branch ("br1", ids ("k1", "k2", "k3")))
			.jumperAdd (new Jumper ("j1", "far"));

		resolver = new ChoiceResolver (arcscript, graph, graph);
	}

	/**
	 * The first true condition wins and its own label is used
	 */
	@Test
	public void _01_FirstTrueCondition () {
		List<Choice> choices = resolver.resolveChoices ("start");
		System.out.println ("Choices: " + choices);

		assertEquals (2, choices.size ());
		Choice choice = choices.get (0);
		assertEquals ("Go", choice.label ());
		assertEquals ("Go", choice.rawLabel ());
		assertEquals ("low", choice.targetId ());
		assertEquals ("br1", choice.branchId ());
		assertEquals ("c1", choice.connectionId ());
	}

	/**
	 * Without a label on the condition's connection the label of the connection into the branch is used
	 */
	@Test
	public void _02_FallbackLabel () {
		arcscript.variableSet ("x", 10);
		assertEquals ("Fallback", resolver.resolveChoices ("start").get (0).label ());
		assertEquals ("high", resolver.resolveChoices ("start").get (0).targetId ());

		arcscript.variableSet ("x", 0);
		assertEquals ("Fallback", resolver.resolveChoices ("start").get (0).label ());
		assertEquals ("none", resolver.resolveChoices ("start").get (0).targetId ());
	}

	/**
	 * With no label anywhere on the way the default is used
	 */
	@Test
	public void _03_DefaultLabel () {
		graph.connectionAdd (new Connection ("c1", "", "start", "br1"));
		arcscript.variableSet ("x", 0);

		Choice choice = resolver.resolveChoices ("start").get (0);
		assertEquals (ChoiceResolver.LABEL_DEFAULT, choice.label ());
		assertEquals ("Continue", choice.label ());
		assertEquals ("", choice.rawLabel ());
	}

	/**
	 * A jumper redirects to its element and keeps the label of the connection into it
	 */
	@Test
	public void _04_Jumper () {
		Choice choice = resolver.resolveChoices ("start").get (1);
		assertEquals ("Leap", choice.label ());
		assertEquals ("far", choice.targetId ());
		assertNull (choice.branchId ());
		assertEquals ("c5", choice.connectionId ());
	}

	/**
	 * A condition may lead on to another branch and then a jumper; the first branch passed is recorded
	 */
	@Test
	public void _05_Chains () {
		graph.elementAdd (element ("deep", "d1"))
			.connectionAdd (new Connection ("d1", "Onward", "deep", "br2"))
			.connectionAdd (new Connection ("d2", "", "m1", "br3"))
			.connectionAdd (new Connection ("d3", "", "m2", "j1"))
			.conditionAdd (new Condition ("m1", "true", "d2"))
			.conditionAdd (new Condition ("m2", " ", "d3"))
			.branchAdd (new Branch ("br2", ids ("m1")))
			.branchAdd (new Branch ("br3", ids ("m2")));

		List<Choice> choices = resolver.resolveChoices ("deep");
		assertEquals (1, choices.size ());
		assertEquals ("Onward", choices.get (0).label ());
		assertEquals ("far", choices.get (0).targetId ());
		assertEquals ("br2", choices.get (0).branchId ());
	}

	/**
	 * No true condition and no else, or a dangling id, gives no choice; no choices means the end
	 */
	@Test
	public void _06_DeadEnds () {
		graph.elementAdd (element ("stuck", "s1", "s2", "missing"))
			.connectionAdd (new Connection ("s1", "Locked", "stuck", "br4"))
			.connectionAdd (new Connection ("s2", "Nowhere", "stuck", "void"))
			.connectionAdd (new Connection ("s3", "", "n1", "high"))
			.conditionAdd (new Condition ("n1", "x > 100", "s3"))
			.branchAdd (new Branch ("br4", ids ("n1")));

		assertEquals (0, resolver.resolveChoices ("stuck").size ());
		assertEquals (true, resolver.isTerminal ("stuck"));
		assertEquals (true, resolver.isTerminal ("high"));
		assertEquals (false, resolver.isTerminal ("start"));
		assertEquals (0, resolver.resolveChoices ("unknown").size ());
		assertEquals (0, arcscript.diagnosticsGet ().size ());
	}

	/**
	 * Branches that lead back to each other are reported and stop resolution
	 */
	@Test
	public void _07_Cycle () {
		graph.elementAdd (element ("loop", "l1"))
			.connectionAdd (new Connection ("l1", "", "loop", "br5"))
			.connectionAdd (new Connection ("l2", "", "p1", "br6"))
			.connectionAdd (new Connection ("l3", "", "p2", "br5"))
			.conditionAdd (new Condition ("p1", null, "l2"))
			.conditionAdd (new Condition ("p2", null, "l3"))
			.branchAdd (new Branch ("br5", ids ("p1")))
			.branchAdd (new Branch ("br6", ids ("p2")));

		try {
			resolver.resolveChoices ("loop");
			fail ("Cycle was not detected");
		} catch (CyclicGraphException e) {
			System.out.println ("Cycle: " + e.getMessage ());
			assertEquals ("l1", e.connectionId ());
			assertEquals ("Connection l1 loops back to br5", e.getMessage ());
		}

		assertEquals (ErrorType.CYCLIC_GRAPH, arcscript.diagnosticsGet ().get (0).type ());
	}

	/**
	 * Long chains are cut off at the configured number of hops
	 */
	@Test
	public void _08_DepthLimit () {
		graph.elementAdd (element ("chain", "h0"));
		for (int i = 0; i < 4; ++i) {
			graph.connectionAdd (new Connection ("h" + i, "", i == 0 ? "chain" : "q" + (i - 1), "b" + i))
				.conditionAdd (new Condition ("q" + i, null, "h" + (i + 1)))
				.branchAdd (new Branch ("b" + i, ids ("q" + i)));
		}
		graph.connectionAdd (new Connection ("h4", "", "q3", "high"));

		arcscript.resolveDepthSet (4);
		assertEquals ("high", resolver.resolveChoices ("chain").get (0).targetId ());

		arcscript.resolveDepthSet (3);
		try {
			resolver.resolveChoices ("chain");
			fail ("Depth limit was not applied");
		} catch (CyclicGraphException e) {
			assertEquals ("Connection h0 passes more than 3 branches and jumpers", e.getMessage ());
		}

		arcscript.resolveDepthSet (-1);
		assertEquals (32, arcscript.resolveDepthGet ());
	}

	/**
	 * Labels are shown evaluated, their assignments only apply once chosen
	 */
	@Test
	public void _09_LabelScripts () {
		arcscript.variableDeclare ("gold", Value.of (5));
		graph.connectionAdd (new Connection ("c5", "gold += 1\nTake {gold} gold", "start", "j1"));

		Choice choice = resolver.resolveChoices ("start").get (1);
		assertEquals ("Take 5 gold", choice.label ());
		assertEquals ("gold += 1\nTake {gold} gold", choice.rawLabel ());
		assertEquals (Value.of (5), arcscript.variableGet ("gold"));
	}

	/**
	 * visits() without an argument in a condition counts the element being resolved
	 */
	@Test
	public void _10_VisitsInConditions () {
		graph.elementAdd (element ("again", "v1"))
			.connectionAdd (new Connection ("v1", "Return", "again", "br7"))
			.connectionAdd (new Connection ("v2", "", "w1", "high"))
			.conditionAdd (new Condition ("w1", "visits() > 1", "v2"))
			.branchAdd (new Branch ("br7", ids ("w1")));

		arcscript.stateGet ().visitsIncrement ("again");
		assertEquals (true, resolver.isTerminal ("again"));

		arcscript.stateGet ().visitsIncrement ("again");
		assertEquals (false, resolver.isTerminal ("again"));
		assertEquals ("again", arcscript.stateGet ().currentElementId ());
	}

	/**
	 * Only a last else is accepted in a branch
	 */
	@Test
	public void _11_BranchLayout () {
		try {
			graph.branchAdd (new Branch ("bad", ids ("k3", "k1")));
			fail ("Else before the last position was accepted");
		} catch (IllegalArgumentException e) {
			assertEquals ("Branch bad has else condition k3 before its last position", e.getMessage ());
		}

		try {
			graph.branchAdd (new Branch ("bad", ids ("k1", "zz")));
			fail ("Unknown condition was accepted");
		} catch (IllegalArgumentException e) {
			assertEquals ("Branch bad refers to unknown condition zz", e.getMessage ());
		}

		assertNull (graph.branch ("bad"));
		graph.branchAdd (new Branch ("empty", Collections.<String>emptyList ()));
		assertEquals (0, graph.branch ("empty").conditionIds ().size ());
	}

	/**
	 * Element titles are cleaned of markup for visit keys
	 */
	@Test
	public void _12_TitleKey () {
		Element element = new Element ("e1", " <p><strong>The&nbsp;Gate</strong></p> ", null, null);
		assertEquals ("The Gate", element.titleKey ());
		assertEquals ("", element.content ());
		assertEquals (0, element.outputs ().size ());
		assertEquals ("", graph.contentText ("nope"));
		assertEquals ("Go", graph.linkLabel ("c3"));
		assertEquals ("start", graph.startingElementGet ());
	}
}
