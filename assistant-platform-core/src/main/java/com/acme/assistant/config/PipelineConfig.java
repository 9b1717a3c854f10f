package com.acme.assistant.config;

/** Tuning for the default pipeline stages. */
public class PipelineConfig {

  private int historyLimit = 50;
  private int memoryLimit = 5;
  private double memoryThreshold = 0.6;
  private int summaryTrigger = 40;
  private int summaryKeepTail = 10;

  public int getHistoryLimit() {
    return historyLimit;
  }

  public void setHistoryLimit(int historyLimit) {
    this.historyLimit = historyLimit;
  }

  public int getMemoryLimit() {
    return memoryLimit;
  }

  public void setMemoryLimit(int memoryLimit) {
    this.memoryLimit = memoryLimit;
  }

  public double getMemoryThreshold() {
    return memoryThreshold;
  }

  public void setMemoryThreshold(double memoryThreshold) {
    this.memoryThreshold = memoryThreshold;
  }

  public int getSummaryTrigger() {
    return summaryTrigger;
  }

  public void setSummaryTrigger(int summaryTrigger) {
    this.summaryTrigger = summaryTrigger;
  }

  public int getSummaryKeepTail() {
    return summaryKeepTail;
  }

  public void setSummaryKeepTail(int summaryKeepTail) {
    this.summaryKeepTail = summaryKeepTail;
  }
}
