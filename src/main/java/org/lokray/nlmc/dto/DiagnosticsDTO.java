package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class DiagnosticsDTO
{
	public List<String> semanticErrors = new ArrayList<>();
	public List<String> remainingAmbiguities = new ArrayList<>();
	public List<String> recoveryActions = new ArrayList<>();
	public List<String> warnings = new ArrayList<>();
}
