package org.waabox.budman.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The configuration a new budget starts from.
 *
 * <p>Two institutions, a bank and a brokerage, and the three workflows a
 * transaction export goes through: intake drops new exports in
 * {@code data/new}, categorization writes categorized copies to
 * {@code data/categorized} and finalization moves them to
 * {@code data/finalized}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DefaultConfiguration {

  /** The default budget root folder. */
  public static final String ROOT_FOLDER = "~/OneDrive/budget";

  /** The default financial institution key. */
  public static final String DEFAULT_FI = "boa";

  /** The default workflow key. */
  public static final String DEFAULT_WORKFLOW = "categorization";

  /** The default purpose value. */
  public static final String DEFAULT_PURPOSE = "working";

  /** Private constructor to prevent instantiation. */
  private DefaultConfiguration() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Builds the default configuration record.
   *
   * @return a new record, never null.
   */
  public static ConfigurationRecord create() {
    return create(ROOT_FOLDER);
  }

  /** Builds the default configuration record under another root folder.
   *
   * @param rootFolder the budget root folder, cannot be null.
   *
   * @return a new record, never null.
   */
  public static ConfigurationRecord create(final String rootFolder) {
    final List<FinancialInstitutionRecord> institutions = List.of(
        new FinancialInstitutionRecord("boa", "Bank of America", "bank",
            "boa", List.of()),
        new FinancialInstitutionRecord("merrill", "Merrill Lynch",
            "brokerage", "merrill", List.of()));

    final List<WorkflowRecord> workflows = List.of(
        new WorkflowRecord("intake", "Intake",
            ordered("wf_working", "data/new",
                "wf_out", "data/categorized"),
            ordered("working", "wf_working", "output", "wf_out"),
            ordered("wf_out", "categorized_")),
        new WorkflowRecord("categorization", "Categorization",
            ordered("wf_in", "data/new",
                "wf_working", "data/categorized",
                "wf_out", "data/finalized"),
            ordered("input", "wf_in", "working", "wf_working",
                "output", "wf_out"),
            ordered("wf_working", "categorized_", "wf_out", "finalized_")),
        new WorkflowRecord("finalization", "Finalization",
            ordered("wf_in", "data/categorized",
                "wf_out", "data/finalized"),
            ordered("input", "wf_in", "working", "wf_out",
                "output", "wf_out"),
            ordered("wf_in", "categorized_", "wf_out", "finalized_")));

    return new ConfigurationRecord(
        "budget",
        rootFolder,
        institutions,
        workflows,
        Map.of(ConfigurationRecord.OPTION_WORKBOOK_EXTENSIONS, ".xlsx,.csv"),
        new WorkingStateRecord(DEFAULT_FI, DEFAULT_WORKFLOW, DEFAULT_PURPOSE,
            null, false),
        null,
        null,
        null);
  }

  /** Builds an insertion ordered map from key value pairs.
   *
   * @param pairs alternating keys and values.
   *
   * @return the map, never null.
   */
  private static Map<String, String> ordered(final String... pairs) {
    final Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }
}
