package az.zeynalov.skiplist.benchmark;

import az.zeynalov.skiplist.SkipList;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;

@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(value = 1)
public class SkipListBenchmark {

  private static final long SEED = 42L;

  // =========================================================================
  //  DETERMINISTIC SKIP LIST STATE
  // =========================================================================

  @State(Scope.Thread)
  public static class SkipListState {
    @Param({"1000", "10000", "100000"})
    int size;

    SkipList<Integer, Integer> skipList;

    Integer[] keys;
    Integer missingKey;
    int index;

    @Setup(Level.Trial)
    public void setup() {
      skipList = SkipList.forIntegers();
      keys = shuffledKeys(size);

      // Pre-fill the skip list for the FIND benchmarks
      for (Integer key : keys) {
        skipList.insert(key, key);
      }

      missingKey = -1;
      index = 0;
    }

    public Integer nextKey() {
      return keys[index++ % size];
    }
  }

  // =========================================================================
  //  JDK STATE (Baseline)
  // =========================================================================

  @State(Scope.Thread)
  public static class JdkState {
    @Param({"1000", "10000", "100000"})
    int size;

    TreeMap<Integer, Integer> treeMap;
    ConcurrentSkipListMap<Integer, Integer> cslm;

    Integer[] keys;
    Integer missingKey = -1;
    int index;

    @Setup(Level.Trial)
    public void setup() {
      treeMap = new TreeMap<>();
      cslm = new ConcurrentSkipListMap<>();
      keys = shuffledKeys(size);

      for (Integer key : keys) {
        treeMap.put(key, key);
        cslm.put(key, key);
      }
      index = 0;
    }

    public Integer nextKey() {
      return keys[index++ % size];
    }
  }

  // =========================================================================
  //  BENCHMARKS: INSERT
  // =========================================================================

  @Benchmark
  public void insertFresh_skipList(Blackhole bh) {
    SkipList<Integer, Integer> skipList = SkipList.forIntegers();
    for (int i = 0; i < 1000; i++) {
      skipList.insert(i, i);
    }
    bh.consume(skipList.numLayers());
  }

  @Benchmark
  public void insertFresh_treeMap(Blackhole bh) {
    TreeMap<Integer, Integer> treeMap = new TreeMap<>();
    for (int i = 0; i < 1000; i++) {
      treeMap.put(i, i);
    }
    bh.consume(treeMap.size());
  }

  @Benchmark
  public void insertDuplicate_skipList(SkipListState state, Blackhole bh) {
    bh.consume(state.skipList.insert(state.nextKey(), 0));
  }

  // =========================================================================
  //  BENCHMARKS: FIND
  // =========================================================================

  @Benchmark
  public void find_skipList(SkipListState state, Blackhole bh) {
    bh.consume(state.skipList.find(state.nextKey()));
  }

  @Benchmark
  public void find_treeMap(JdkState state, Blackhole bh) {
    bh.consume(state.treeMap.get(state.nextKey()));
  }

  @Benchmark
  public void find_concurrentSkipListMap(JdkState state, Blackhole bh) {
    bh.consume(state.cslm.get(state.nextKey()));
  }

  // =========================================================================
  //  BENCHMARKS: MISS
  // =========================================================================

  @Benchmark
  public void miss_skipList(SkipListState state, Blackhole bh) {
    bh.consume(state.skipList.contains(state.missingKey));
  }

  @Benchmark
  public void miss_treeMap(JdkState state, Blackhole bh) {
    bh.consume(state.treeMap.containsKey(state.missingKey));
  }

  // =========================================================================
  //  BENCHMARKS: SCAN
  // =========================================================================

  @Benchmark
  public void scan_skipList(SkipListState state, Blackhole bh) {
    state.skipList.forEach((k, v) -> bh.consume(k));
  }

  @Benchmark
  public void scan_treeMap(JdkState state, Blackhole bh) {
    state.treeMap.forEach((k, v) -> bh.consume(k));
  }

  // =========================================================================
  //  HELPERS
  // =========================================================================

  private static Integer[] shuffledKeys(int size) {
    List<Integer> keys = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      keys.add(i);
    }
    Collections.shuffle(keys, new Random(SEED));
    return keys.toArray(new Integer[0]);
  }

  public static void main(String[] args) throws RunnerException {
    Options opts = new OptionsBuilder()
        .include(SkipListBenchmark.class.getSimpleName())
        .build();
    new Runner(opts).run();
  }
}
