package com.crossstitch.publisher.infrastructure.progress;

import com.crossstitch.publisher.application.port.ProgressSink;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProgressSink} that funnels messages from any thread to a single owner thread.
 * <p><strong>Role:</strong> Lets verifier workers and the campaign loop report progress while exactly one thread
 * writes to the console or log.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} launches the drain thread; {@link #close()} delivers every queued
 * message and stops it. Messages reported after close are dropped with a debug log.</p>
 * <p><strong>Thread-safety:</strong> {@link #report(String)} is safe for concurrent producers.</p>
 *
 * @since 0.1.0
 */
public final class ProgressChannel implements ProgressSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);
  private static final Entry END = new Entry(null);

  private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
  private final Consumer<String> consumer;
  private final Thread owner;
  private volatile boolean closed;

  /**
   * Creates a channel.
   *
   * @param name drain thread name
   * @param consumer receives each message on the drain thread
   */
  public ProgressChannel(String name, Consumer<String> consumer) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.owner = new Thread(this::drain, Objects.requireNonNull(name, "name"));
    this.owner.setDaemon(true);
  }

  /**
   * Starts the drain thread.
   *
   * @return this channel
   */
  public ProgressChannel start() {
    owner.start();
    return this;
  }

  @Override
  public void report(String message) {
    if (closed) {
      log.debug("Progress message after close dropped: {}", message);
      return;
    }
    queue.add(new Entry(Objects.requireNonNull(message, "message")));
  }

  private void drain() {
    try {
      while (true) {
        Entry entry = queue.take();
        if (entry == END) {
          return;
        }
        deliver(entry.message());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      drainRemaining();
    }
  }

  private void drainRemaining() {
    Entry entry;
    while ((entry = queue.poll()) != null && entry != END) {
      deliver(entry.message());
    }
  }

  private void deliver(String message) {
    try {
      consumer.accept(message);
    } catch (RuntimeException ex) {
      log.warn("Progress consumer failed for message: {}", message, ex);
    }
  }

  /**
   * Flushes queued messages and stops the drain thread.
   *
   * @throws InterruptedException if interrupted while waiting for the drain thread
   */
  @Override
  public void close() throws InterruptedException {
    if (closed) {
      return;
    }
    closed = true;
    queue.add(END);
    if (owner.isAlive()) {
      owner.join();
    } else {
      drainRemaining();
    }
  }

  private record Entry(String message) {}
}
