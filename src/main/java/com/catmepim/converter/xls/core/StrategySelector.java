package com.catmepim.converter.xls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.core.globals.WorksheetGlobals;
import com.catmepim.converter.xls.strategy.IndexedTraversalStrategy;
import com.catmepim.converter.xls.strategy.RowTraversalStrategy;
import com.catmepim.converter.xls.strategy.SequentialTraversalStrategy;

/**
 * Selects the {@link RowTraversalStrategy} for a worksheet.
 *
 * @invariant A sheet with an INDEX record is walked by block; any other sheet sequentially.
 */
public class StrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(StrategySelector.class);

    /**
     * @pre sheet != null
     * @post a non-null strategy is returned
     */
    public RowTraversalStrategy selectStrategy(WorksheetGlobals sheet) {
        if (sheet.hasIndex()) {
            logger.debug("Sheet '{}' has an INDEX with {} block(s): selecting IndexedTraversalStrategy",
                    sheet.getWorksheet().getName(), sheet.getIndex().getBlockCount());
            return new IndexedTraversalStrategy();
        }
        logger.debug("Sheet '{}' has no INDEX: selecting SequentialTraversalStrategy", sheet.getWorksheet().getName());
        return new SequentialTraversalStrategy();
    }
}
