package com.reqflow.core.delegator;

import com.reqflow.core.capability.RequirementMiner;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;
import com.reqflow.core.pool.HandlerContext;
import com.reqflow.core.pool.PhaseHandler;

import java.util.ArrayList;

/**
 * Mines one document. Mined requirements are renumbered {@code <documentId>-REQ-<nnn>} so ids
 * stay unique across the documents of a run; blank statements are dropped.
 */
public class MiningHandler implements PhaseHandler<SourceDocument, MiningYield> {

    private final RequirementMiner miner;

    public MiningHandler(RequirementMiner miner) {
        this.miner = miner;
    }

    @Override
    public MiningYield handle(SourceDocument document, HandlerContext ctx) {
        ctx.token().throwIfCancelled();
        var mined = miner.mine(document);
        var items = new ArrayList<RequirementItem>();
        for (RequirementItem item : mined) {
            if (item.text().isBlank()) {
                continue;
            }
            String sourceRef = item.sourceRef() != null ? item.sourceRef()
                    : document.sourceRef() != null ? document.sourceRef() : document.id();
            items.add(RequirementItem.of(itemId(document.id(), items.size() + 1), item.text().trim(), sourceRef));
        }
        return new MiningYield(document.id(), items);
    }

    static String itemId(String documentId, int ordinal) {
        return String.format("%s-REQ-%03d", documentId, ordinal);
    }
}
