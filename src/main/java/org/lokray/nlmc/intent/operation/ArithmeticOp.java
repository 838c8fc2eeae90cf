package org.lokray.nlmc.intent.operation;

public enum ArithmeticOp
{
	ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO, POWER
}
