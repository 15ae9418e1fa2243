package org.ergoplatform.ergoscript.eval;

import org.ergoplatform.ergoscript.data.Coll;
import org.ergoplatform.ergoscript.data.GroupElement;

/** Header fields known before a block is mined. */
public record PreHeader(
    byte version,
    Coll parentId,
    long timestamp,
    long nBits,
    int height,
    GroupElement minerPk,
    Coll votes
) {
    public Object property(String name) {
        return switch (name) {
            case "version" -> version;
            case "parentId" -> parentId;
            case "timestamp" -> timestamp;
            case "nBits" -> nBits;
            case "height" -> height;
            case "minerPk" -> minerPk;
            case "votes" -> votes;
            default -> throw new EvaluationException("Unknown PreHeader property '" + name + "'");
        };
    }
}
