package org.opgraph.lowering;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Time-sorted ids for emitted operations. Ids created later in the same
 * process compare greater, which keeps storage indexes append-friendly.
 */
public final class OperationIds {

    private OperationIds() {
    }

    public static String next() {
        return TsidCreator.getTsid().toString();
    }
}
