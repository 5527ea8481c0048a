package com.spot.dataset.memory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory index of records shared by all filters of a dataset. Every filter owns one {@link
 * Dimension}: a multi-valued string key per record, an optional key predicate and one grouped
 * reduction. A record counts towards a dimension's groups only when no other dimension rejects it,
 * so a dimension never restricts itself. Changing a predicate updates the groups of the records
 * whose rejection actually changed.
 */
public class CrossIndex {
  private final List<Map<String, Object>> records = new ArrayList<>();
  private final List<Dimension> dimensions = new ArrayList<>();
  private int[] rejectCount = new int[0];
  private int selected = 0;

  public synchronized int size() {
    return records.size();
  }

  /** Records not rejected by any dimension. */
  public synchronized int selectedCount() {
    return selected;
  }

  public synchronized List<Map<String, Object>> records() {
    return Collections.unmodifiableList(new ArrayList<>(records));
  }

  public synchronized int dimensionCount() {
    return dimensions.size();
  }

  public synchronized void add(List<Map<String, Object>> newRecords) {
    int start = records.size();
    records.addAll(newRecords);
    rejectCount = Arrays.copyOf(rejectCount, records.size());

    for (Dimension dimension : dimensions) {
      dimension.appendKeys(start);
    }
    for (int r = start; r < records.size(); r++) {
      if (rejectCount[r] == 0) {
        selected++;
      }
      for (Dimension dimension : dimensions) {
        if (dimension.group != null && dimension.includes(r)) {
          dimension.group.add(r);
        }
      }
    }
  }

  public synchronized Dimension dimension(
      Function<Map<String, Object>, Collection<String>> keyFunction) {
    Dimension dimension = new Dimension(keyFunction);
    dimension.appendKeys(0);
    dimensions.add(dimension);
    return dimension;
  }

  /** Per filter view of the index. */
  public final class Dimension {
    private final Function<Map<String, Object>, Collection<String>> keyFunction;
    private final List<ImmutableList<String>> keys = new ArrayList<>();
    private final BitSet rejected = new BitSet();
    private Predicate<String> predicate;
    private Group<?> group;
    private boolean disposed = false;

    private Dimension(Function<Map<String, Object>, Collection<String>> keyFunction) {
      this.keyFunction = keyFunction;
    }

    private void appendKeys(int start) {
      for (int r = start; r < records.size(); r++) {
        ImmutableList<String> recordKeys =
            ImmutableList.copyOf(new LinkedHashSet<>(keyFunction.apply(records.get(r))));
        keys.add(recordKeys);
        if (predicate != null && !anyMatch(recordKeys, predicate, new HashMap<>())) {
          rejected.set(r);
          rejectCount[r]++;
        }
      }
    }

    private boolean includes(int r) {
      return rejectCount[r] - (rejected.get(r) ? 1 : 0) == 0;
    }

    public ImmutableList<String> keys(int record) {
      synchronized (CrossIndex.this) {
        return keys.get(record);
      }
    }

    public <A> Group<A> group(Reducer<A> reducer) {
      synchronized (CrossIndex.this) {
        Group<A> newGroup = new Group<>(this, reducer);
        for (int r = 0; r < records.size(); r++) {
          if (includes(r)) {
            newGroup.add(r);
          }
        }
        this.group = newGroup;
        return newGroup;
      }
    }

    /** Restricts the other dimensions to records with at least one key passing the predicate. */
    public void filterFunction(Predicate<String> newPredicate) {
      synchronized (CrossIndex.this) {
        predicate = newPredicate;
        Map<String, Boolean> memo = new HashMap<>();
        for (int r = 0; r < records.size(); r++) {
          boolean reject = newPredicate != null && !anyMatch(keys.get(r), newPredicate, memo);
          if (reject != rejected.get(r)) {
            updateRejection(r, reject);
          }
        }
      }
    }

    public void filterAll() {
      filterFunction(null);
    }

    public boolean hasFilter() {
      synchronized (CrossIndex.this) {
        return predicate != null;
      }
    }

    public void dispose() {
      synchronized (CrossIndex.this) {
        if (disposed) {
          return;
        }
        filterAll();
        dimensions.remove(this);
        keys.clear();
        group = null;
        disposed = true;
      }
    }

    private void updateRejection(int r, boolean reject) {
      int before = rejectCount[r];
      int after = before + (reject ? 1 : -1);
      for (Dimension other : dimensions) {
        if (other == this || other.group == null) {
          continue;
        }
        int own = other.rejected.get(r) ? 1 : 0;
        boolean wasIncluded = before - own == 0;
        boolean isIncluded = after - own == 0;
        if (wasIncluded && !isIncluded) {
          other.group.remove(r);
        } else if (!wasIncluded && isIncluded) {
          other.group.add(r);
        }
      }
      rejected.set(r, reject);
      rejectCount[r] = after;
      if (before == 0 && after > 0) {
        selected--;
      } else if (before > 0 && after == 0) {
        selected++;
      }
    }
  }

  private static boolean anyMatch(
      List<String> recordKeys, Predicate<String> predicate, Map<String, Boolean> memo) {
    for (String key : recordKeys) {
      if (memo.computeIfAbsent(key, predicate::test)) {
        return true;
      }
    }
    return false;
  }

  /** Reduction of a dimension's included records, per key. */
  public final class Group<A> {
    private final Dimension dimension;
    private final Reducer<A> reducer;
    private final TreeMap<String, A> values = new TreeMap<>();

    private Group(Dimension dimension, Reducer<A> reducer) {
      this.dimension = dimension;
      this.reducer = reducer;
    }

    private void add(int r) {
      Map<String, Object> record = records.get(r);
      for (String key : dimension.keys.get(r)) {
        reducer.add(values.computeIfAbsent(key, k -> reducer.initial()), record);
      }
    }

    private void remove(int r) {
      Map<String, Object> record = records.get(r);
      for (String key : dimension.keys.get(r)) {
        A accumulator = values.get(key);
        if (accumulator != null) {
          reducer.remove(accumulator, record);
        }
      }
    }

    /** Accumulators by key in key order; keys whose records all left the group are kept. */
    public ImmutableMap<String, A> all() {
      synchronized (CrossIndex.this) {
        return ImmutableMap.copyOf(values);
      }
    }
  }
}
