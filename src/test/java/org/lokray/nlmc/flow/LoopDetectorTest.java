package org.lokray.nlmc.flow;

import org.junit.jupiter.api.Test;
import org.lokray.nlmc.intent.operation.LoopOperation;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LoopDetectorTest
{
	private static TripCount tripCount(String condition)
	{
		return LoopDetector.estimateTripCount(Optional.of(new LoopOperation(condition, List.of())));
	}

	@Test
	void repeatCountIsConstant()
	{
		assertEquals(TripCount.constant(5), tripCount("repeat 5 times"));
	}

	@Test
	void upperBoundsAreConstant()
	{
		assertEquals(TripCount.constant(10), tripCount("i < 10"));
		assertEquals(TripCount.constant(11), tripCount("i <= 10"));
	}

	@Test
	void bareIdentifierIsVariable()
	{
		TripCount count = tripCount("n");
		assertEquals(TripCount.Kind.VARIABLE, count.getKind());
		assertEquals("n", count.getVariable());
		assertEquals("Variable(n)", count.toString());
	}

	@Test
	void everythingElseIsUnknown()
	{
		assertEquals(TripCount.UNKNOWN, tripCount("true"));
		assertEquals(TripCount.UNKNOWN, tripCount(LoopOperation.UNKNOWN_CONDITION));
		assertEquals(TripCount.UNKNOWN, tripCount("until the user is happy"));
		assertEquals(TripCount.UNKNOWN, LoopDetector.estimateTripCount(Optional.empty()));
		assertEquals("Unknown", TripCount.UNKNOWN.toString());
	}
}
