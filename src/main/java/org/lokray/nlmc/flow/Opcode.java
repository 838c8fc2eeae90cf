package org.lokray.nlmc.flow;

public enum Opcode
{
	// Arithmetic
	ADD, SUB, MUL, DIV, MOD,
	// Logical
	AND, OR, XOR, NOT,
	// Comparison
	EQ, NE, LT, LE, GT, GE,
	// Memory
	LOAD, STORE, ALLOCA,
	// Control flow
	BR, COND_BR, RET, CALL,
	// Conversion
	CAST, TRUNC, EXT,
	PHI, SELECT;

	public boolean isArithmetic()
	{
		return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
	}

	public boolean isCommutative()
	{
		return this == ADD || this == MUL || this == AND || this == OR || this == XOR || this == EQ || this == NE;
	}
}
