package com.probnet.xdsl.table;

import java.util.List;

/**
 * Permutes the axes of a flat table.
 *
 * <p>
 * For every output slot the flat index is decomposed into a multi-index over
 * the target axes, recomposed with the source strides, and the value copied.
 * The mapping is a bijection: each output slot is written exactly once.
 */
public final class TableReindexer {
    private TableReindexer() {
        // Utility class
    }

    /**
     * @param values      flat values laid out as {@code source}
     * @param source      axes of {@code values}, outermost first
     * @param targetOrder axis names outermost first; a permutation of the source axes
     * @return the same cells laid out in {@code targetOrder}
     */
    public static double[] permute(double[] values, TableShape source, List<String> targetOrder) {
        if (values.length != source.size())
            throw new IllegalArgumentException("Table has " + values.length + " values, shape " + source
                    + " needs " + source.size());
        TableShape target = source.reorder(targetOrder);
        if (isIdentity(source, targetOrder))
            return values.clone();
        int rank = target.rank();

        // Source stride of each target axis.
        int[] srcStride = new int[rank];
        int[] dims = new int[rank];
        for (int t = 0; t < rank; t++) {
            dims[t] = target.axes().get(t).size();
            srcStride[t] = source.stride(source.indexOf(targetOrder.get(t)));
        }

        double[] out = new double[values.length];
        int[] idx = new int[rank];
        int srcOff = 0;
        for (int o = 0; o < out.length; o++) {
            out[o] = values[srcOff];
            // Odometer increment over the target axes, innermost first.
            for (int t = rank - 1; t >= 0; t--) {
                idx[t]++;
                srcOff += srcStride[t];
                if (idx[t] < dims[t])
                    break;
                srcOff -= srcStride[t] * dims[t];
                idx[t] = 0;
            }
        }
        return out;
    }

    /** Whether {@code targetOrder} leaves the layout unchanged. */
    public static boolean isIdentity(TableShape source, List<String> targetOrder) {
        return source.axisNames().equals(targetOrder);
    }
}
