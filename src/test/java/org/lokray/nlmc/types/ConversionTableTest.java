package org.lokray.nlmc.types;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversionTableTest
{
	private static final IntegerBaseType I16 = new IntegerBaseType(16, true);
	private static final IntegerBaseType U32 = new IntegerBaseType(32, false);

	@Test
	void integerWideningIsFreeAndImplicit()
	{
		TypeConversion conversion = ConversionTable.analyze("a", I16, "b", IntegerBaseType.I32);
		assertEquals(ConversionKind.IMPLICIT, conversion.getKind());
		assertEquals(ConversionCost.FREE, conversion.getCost());
		assertTrue(conversion.isSafe());
	}

	@Test
	void integerNarrowingOrSignChangeIsExplicit()
	{
		TypeConversion narrowing = ConversionTable.analyze("a", IntegerBaseType.I64, "b", IntegerBaseType.I32);
		assertEquals(ConversionKind.EXPLICIT, narrowing.getKind());
		assertEquals(ConversionCost.CHEAP, narrowing.getCost());
		assertFalse(narrowing.isSafe());

		assertFalse(ConversionTable.analyze("a", IntegerBaseType.I32, "b", U32).isSafe());
	}

	@Test
	void floatToIntegerTruncates()
	{
		TypeConversion conversion = ConversionTable.analyze("a", FloatBaseType.F64, "b", IntegerBaseType.I32);
		assertEquals(ConversionKind.EXPLICIT, conversion.getKind());
		assertEquals(ConversionCost.MODERATE, conversion.getCost());
		assertFalse(conversion.isSafe());
	}

	@Test
	void integerToFloatIsImplicit()
	{
		TypeConversion conversion = ConversionTable.analyze("a", IntegerBaseType.I32, "b", FloatBaseType.F64);
		assertEquals(ConversionKind.IMPLICIT, conversion.getKind());
		assertEquals(ConversionCost.CHEAP, conversion.getCost());
	}

	@Test
	void unrelatedTypesAreProhibitedAndLeftOut()
	{
		assertEquals(ConversionCost.PROHIBITED,
				ConversionTable.analyze("a", BooleanBaseType.INSTANCE, "b", IntegerBaseType.I32).getCost());

		Map<String, InferredType> types = new LinkedHashMap<>();
		types.put("flag", new InferredType("bool", BooleanBaseType.INSTANCE, false, Lifetime.STATIC, Mutability.MUTABLE, Ownership.OWNED, List.of()));
		types.put("n", new InferredType("i32", IntegerBaseType.I32, false, Lifetime.STATIC, Mutability.MUTABLE, Ownership.OWNED, List.of()));
		types.put("m", new InferredType("i16", I16, false, Lifetime.STATIC, Mutability.MUTABLE, Ownership.OWNED, List.of()));

		List<TypeConversion> conversions = ConversionTable.compute(types);

		assertEquals(2, conversions.size());
		assertEquals("n", conversions.get(0).getFromType());
		assertEquals("m", conversions.get(0).getToType());
		assertEquals(ConversionKind.EXPLICIT, conversions.get(0).getKind());
		assertEquals(ConversionKind.IMPLICIT, conversions.get(1).getKind());
	}
}
