package org.lokray.nlmc.flow;

public enum DataFlowKind
{
	DEFINITION, USE, DEF_USE, ANTI_DEPENDENCE, OUTPUT_DEPENDENCE
}
