package ddac.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/** Named list of numeric fields with a name to slot index lookup. */
public final class RecordLayout {
  private final SimulationLayout.Storage storage;
  private final List<String> fields;
  private final Map<String, Integer> index;

  RecordLayout(SimulationLayout.Storage storage, List<String> fields) {
    this.storage = storage;
    this.fields = List.copyOf(fields);
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < this.fields.size(); ++i)
      index.put(this.fields.get(i), i);
    this.index = Collections.unmodifiableMap(index);
  }

  public SimulationLayout.Storage storage() { return storage; }

  public List<String> fields() { return fields; }

  public int size() { return fields.size(); }

  public boolean isEmpty() { return fields.isEmpty(); }

  public OptionalInt indexOf(String name) {
    Integer ret = index.get(name);
    return ret == null ? OptionalInt.empty() : OptionalInt.of(ret);
  }

  @Override
  public String toString() {
    return storage + fields.toString();
  }
}
