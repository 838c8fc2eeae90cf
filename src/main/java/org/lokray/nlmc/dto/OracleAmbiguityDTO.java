package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class OracleAmbiguityDTO
{
	public String id;
	public String description;
	public String context;
	public List<String> possibleInterpretations = new ArrayList<>();
	public List<Double> confidenceScores = new ArrayList<>();
}
