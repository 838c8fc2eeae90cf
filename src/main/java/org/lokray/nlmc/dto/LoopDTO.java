package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class LoopDTO
{
	public String header;
	public String latch;
	public List<String> body = new ArrayList<>();
	public List<String> exits = new ArrayList<>();
	public int depth;
	public String parent;
	public String tripCount;
	public List<String> invariantInstructions = new ArrayList<>();
}
