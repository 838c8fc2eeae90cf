package org.lokray.nlmc.semantic;

import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.StorageScope;

public class VariableInfo
{
	private final String name;
	private final DataType dataType;
	private final StorageScope scope;
	private final boolean mutable;
	private final boolean initializationRequired;
	private int usageCount;

	public VariableInfo(String name, DataType dataType, StorageScope scope, boolean mutable, boolean initializationRequired)
	{
		this.name = name;
		this.dataType = dataType;
		this.scope = scope;
		this.mutable = mutable;
		this.initializationRequired = initializationRequired;
	}

	void recordUse()
	{
		usageCount++;
	}

	public String getName()
	{
		return name;
	}

	public DataType getDataType()
	{
		return dataType;
	}

	public String getTypeName()
	{
		return dataType.getName();
	}

	public StorageScope getScope()
	{
		return scope;
	}

	public boolean isMutable()
	{
		return mutable;
	}

	/**
	 * True when the data structure has no initial value.
	 */
	public boolean isInitializationRequired()
	{
		return initializationRequired;
	}

	public int getUsageCount()
	{
		return usageCount;
	}
}
