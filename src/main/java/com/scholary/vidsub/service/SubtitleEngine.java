package com.scholary.vidsub.service;

import com.scholary.vidsub.logging.StructuredLogger;
import com.scholary.vidsub.reconcile.TextReconciler;
import com.scholary.vidsub.reconcile.TranslationUnit;
import com.scholary.vidsub.render.Canvas;
import com.scholary.vidsub.render.SubtitleBlock;
import com.scholary.vidsub.render.SubtitleBlockRenderer;
import com.scholary.vidsub.segment.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point to the subtitle synchronization and layout engine.
 *
 * <p>Reconciliation runs on the calling thread because chunk assignment is order dependent. Block
 * rendering fans out across segments on the render executor; blocks come back in segment order.
 */
@Service
public class SubtitleEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleEngine.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final TextReconciler reconciler;
  private final SubtitleBlockRenderer renderer;
  private final Executor renderExecutor;

  public SubtitleEngine(
      TextReconciler reconciler,
      SubtitleBlockRenderer renderer,
      @Qualifier("renderExecutor") Executor renderExecutor) {
    this.reconciler = reconciler;
    this.renderer = renderer;
    this.renderExecutor = renderExecutor;
  }

  /**
   * Map a translation onto the original segments.
   *
   * @param durationSeconds video duration, used when the transcript has no segments
   */
  public List<Segment> reconcile(
      List<Segment> original, TranslationUnit translation, double durationSeconds) {
    return reconciler.reconcile(original, translation, durationSeconds);
  }

  /**
   * Lay out and place one block per segment.
   *
   * <p>The first failure (for example a {@link
   * com.scholary.vidsub.render.FontResolutionException}) is rethrown as-is.
   */
  public List<SubtitleBlock> renderBlocks(List<Segment> segments, Canvas canvas) {
    List<CompletableFuture<SubtitleBlock>> futures = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      futures.add(
          CompletableFuture.supplyAsync(() -> renderer.render(segment, canvas), renderExecutor));
    }

    List<SubtitleBlock> blocks = new ArrayList<>(segments.size());
    for (int i = 0; i < futures.size(); i++) {
      SubtitleBlock block = join(futures.get(i));
      structuredLogger.logBlockRendered(
          i,
          block.lines().size(),
          block.panelWidth(),
          block.panelHeight(),
          block.segment().start(),
          block.segment().end());
      blocks.add(block);
    }

    LOGGER.info(
        "Rendered {} subtitle blocks for a {}x{} canvas",
        blocks.size(),
        canvas.width(),
        canvas.height());
    return blocks;
  }

  private static SubtitleBlock join(CompletableFuture<SubtitleBlock> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }
}
