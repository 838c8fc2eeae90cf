package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * What the oracle answers to the intent extraction prompt. Field names map to snake_case JSON.
 */
public class OracleIntentDTO
{
	public List<OracleOperationDTO> operations = new ArrayList<>();
	public List<OracleDataStructureDTO> dataStructures = new ArrayList<>();
	public List<OracleAmbiguityDTO> ambiguities = new ArrayList<>();
}
