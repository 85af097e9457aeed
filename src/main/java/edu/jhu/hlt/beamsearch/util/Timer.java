package edu.jhu.hlt.beamsearch.util;

import org.apache.log4j.Logger;

/**
 * Accumulates wall-clock time over many start/stop pairs. If a print interval
 * is set, every that many stops the running totals are logged at DEBUG.
 */
public class Timer {
  public static final Logger LOG = Logger.getLogger(Timer.class);

  private String id;
  private int count;
  private long time;
  private long lastStart;
  private boolean running;
  private int printInterval;

  public Timer(String id) {
    this(id, -1);
  }

  public Timer(String id, int printInterval) {
    this.id = id;
    this.printInterval = printInterval;
  }

  public void start() {
    lastStart = System.nanoTime();
    running = true;
  }

  /** returns the time taken (in milliseconds) between the last start/stop pair */
  public long stop() {
    if (!running)
      throw new IllegalStateException("stop called before start: " + id);
    long t = System.nanoTime() - lastStart;
    running = false;
    time += t;
    count++;
    if (printInterval > 0 && count % printInterval == 0 && LOG.isDebugEnabled())
      LOG.debug(this);
    return t / 1_000_000L;
  }

  public int getCount() {
    return count;
  }

  public double totalTimeInSec() {
    return time / 1e9;
  }

  public double secPerCall() {
    if (count == 0)
      return 0d;
    return totalTimeInSec() / count;
  }

  @Override
  public String toString() {
    return String.format("<Timer %s %.3f sec and %d calls total, %.4f sec/call>",
        id, totalTimeInSec(), count, secPerCall());
  }
}
