package org.lokray.nlmc.flow;

import java.util.Objects;

public class Operand
{
	private final OperandKind kind;
	private final String value;
	private final String dataType;

	public Operand(OperandKind kind, String value, String dataType)
	{
		this.kind = Objects.requireNonNull(kind);
		this.value = Objects.requireNonNull(value);
		this.dataType = Objects.requireNonNull(dataType);
	}

	public static Operand register(String value, String dataType)
	{
		return new Operand(OperandKind.REGISTER, value, dataType);
	}

	public static Operand label(String value)
	{
		return new Operand(OperandKind.LABEL, value, "function");
	}

	public OperandKind getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	public String getDataType()
	{
		return dataType;
	}

	public boolean isRegister()
	{
		return kind == OperandKind.REGISTER;
	}

	@Override
	public String toString()
	{
		return kind == OperandKind.LABEL ? "@" + value : value + ":" + dataType;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Operand operand = (Operand) o;
		return kind == operand.kind && value.equals(operand.value) && dataType.equals(operand.dataType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, value, dataType);
	}
}
