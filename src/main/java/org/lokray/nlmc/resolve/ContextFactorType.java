package org.lokray.nlmc.resolve;

public enum ContextFactorType
{
	PREVIOUS_OPERATIONS("PreviousOperations"),
	VARIABLE_TYPES("VariableTypes"),
	DOMAIN_KNOWLEDGE("DomainKnowledge"),
	SYNTACTIC_PATTERNS("SyntacticPatterns"),
	SEMANTIC_CONSTRAINTS("SemanticConstraints"),
	USER_INTENT("UserIntent");

	private final String wireName;

	ContextFactorType(String wireName)
	{
		this.wireName = wireName;
	}

	public String getWireName()
	{
		return wireName;
	}

	/**
	 * Maps an oracle factor name; names it does not know become {@link #USER_INTENT}.
	 */
	public static ContextFactorType fromWireName(String name)
	{
		for (ContextFactorType type : values())
		{
			if (type.wireName.equals(name))
			{
				return type;
			}
		}
		return USER_INTENT;
	}
}
