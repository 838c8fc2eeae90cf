package org.lokray.nlmc.recovery;

public enum CompilationStage
{
	INTENT_EXTRACTION,
	AMBIGUITY_RESOLUTION,
	SEMANTIC_ANALYSIS,
	TYPE_INFERENCE,
	FLOW_ANALYSIS,
	CODE_GENERATION,
	OPTIMIZATION,
	CODE_EMISSION
}
