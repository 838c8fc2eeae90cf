package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;

public enum RuleType
{
	PRONOUN_REFERENCE("PronounReference"),
	OPERATION_DISAMBIGUATION("OperationDisambiguation"),
	TYPE_INFERENCE("TypeInference"),
	SCOPE_RESOLUTION("ScopeResolution"),
	CONTROL_FLOW_CLARIFICATION("ControlFlowClarification");

	private final String displayName;

	RuleType(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}

	/**
	 * Pronoun rules only look at pronoun ambiguities; every other rule kind looks at the rest.
	 */
	public boolean appliesTo(Ambiguity.Kind kind)
	{
		if (this == PRONOUN_REFERENCE)
		{
			return kind == Ambiguity.Kind.PRONOUN;
		}
		return kind != Ambiguity.Kind.PRONOUN;
	}
}
