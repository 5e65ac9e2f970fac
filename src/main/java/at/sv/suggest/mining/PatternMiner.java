package at.sv.suggest.mining;

import at.sv.suggest.history.EntityHistory;

import java.util.List;
import java.util.Map;

/**
 * One mining pass over normalized histories. Implementations must only read the given histories.
 */
public interface PatternMiner {

    PatternType getType();

    List<Pattern> mine(Map<String, EntityHistory> histories);
}
