package org.lokray.nlmc.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ConversionTable
{
	private ConversionTable()
	{
	}

	/**
	 * Classifies the conversion between two base types.
	 */
	public static TypeConversion analyze(String fromName, BaseType from, String toName, BaseType to)
	{
		if (from instanceof IntegerBaseType fromInt && to instanceof IntegerBaseType toInt)
		{
			if (fromInt.getBits() <= toInt.getBits() && fromInt.isSigned() == toInt.isSigned())
			{
				return new TypeConversion(fromName, toName, ConversionKind.IMPLICIT, true, ConversionCost.FREE);
			}
			return new TypeConversion(fromName, toName, ConversionKind.EXPLICIT, false, ConversionCost.CHEAP);
		}
		if (from.isInteger() && to.isFloat())
		{
			return new TypeConversion(fromName, toName, ConversionKind.IMPLICIT, true, ConversionCost.CHEAP);
		}
		if (from.isFloat() && to.isInteger())
		{
			return new TypeConversion(fromName, toName, ConversionKind.EXPLICIT, false, ConversionCost.MODERATE);
		}
		return new TypeConversion(fromName, toName, ConversionKind.CAST, false, ConversionCost.PROHIBITED);
	}

	/**
	 * Every allowed conversion between distinct entries of the map, in map order.
	 */
	public static List<TypeConversion> compute(Map<String, InferredType> types)
	{
		List<TypeConversion> conversions = new ArrayList<>();
		for (Map.Entry<String, InferredType> from : types.entrySet())
		{
			for (Map.Entry<String, InferredType> to : types.entrySet())
			{
				if (from.getKey().equals(to.getKey()))
				{
					continue;
				}
				TypeConversion conversion = analyze(from.getKey(), from.getValue().getBaseType(), to.getKey(), to.getValue().getBaseType());
				if (conversion.getCost() != ConversionCost.PROHIBITED)
				{
					conversions.add(conversion);
				}
			}
		}
		return conversions;
	}
}
