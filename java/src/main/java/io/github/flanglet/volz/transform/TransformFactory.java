/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.volz.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import io.github.flanglet.volz.ByteTransform;

/**
 * Builds the chunk pipelines from their names (stage names joined with '+',
 * e.g. "PRED+RLE+DEFLATE").
 */
public class TransformFactory {
    private static final int ONE_SHIFT = 4; // bits per transform
    private static final int MAX_SHIFT = (4 - 1) * ONE_SHIFT; // 4 transforms
    private static final int MASK = (1 << ONE_SHIFT) - 1;

    public static final short NONE_TYPE = 0;
    public static final short PRED_TYPE = 1;
    public static final short RLE_TYPE = 2;
    public static final short DEFLATE_TYPE = 3;

    /**
     * Pipeline applied to label chunks, whatever the volume flags.
     */
    public static final String LABEL_PIPELINE = "RLE+DEFLATE";


    /**
     * Returns the name of the volume pipeline for the given flags.
     *
     * @param predictive true if predictive coding is enabled
     * @param rle true if run length coding is enabled
     * @return the pipeline name
     */
    public static String getVolumePipeline(boolean predictive, boolean rle) {
        StringBuilder sb = new StringBuilder();

        if (predictive == true)
            sb.append("PRED+");

        if (rle == true)
            sb.append("RLE+");

        sb.append("DEFLATE");
        return sb.toString();
    }


    /**
     * Returns the packed type of a pipeline name.
     *
     * @param name the pipeline name
     * @return the pipeline type
     */
    public long getType(String name) {
        String[] tokens = name.split("\\+");

        if ((tokens.length == 0) || (tokens.length > 4))
            throw new IllegalArgumentException("Unknown transform type: " + name);

        long res = 0;
        int shift = MAX_SHIFT;

        for (String token : tokens) {
            final long typeTk = this.getTypeToken(token);

            // Skip null transform
            if (typeTk != NONE_TYPE) {
                res |= (typeTk << shift);
                shift -= ONE_SHIFT;
            }
        }

        return res;
    }


    private long getTypeToken(String name) {
        switch (name.toUpperCase()) {
        case "PRED":
            return PRED_TYPE;

        case "RLE":
            return RLE_TYPE;

        case "DEFLATE":
            return DEFLATE_TYPE;

        case "NONE":
            return NONE_TYPE;

        default:
            throw new IllegalArgumentException("Unknown transform type: '" + name + "'");
        }
    }


    /**
     * Creates the pipeline for a packed type.
     *
     * @param ctx the context map, must hold "chunkDim" when PRED is present
     *            and "level" for DEFLATE
     * @param functionType the packed type
     * @return the pipeline
     */
    public Sequence newFunction(Map<String, Object> ctx, long functionType) {
        List<ByteTransform> transforms = new ArrayList<>(4);

        for (int i = 0; i < 4; i++) {
            final int t = (int) ((functionType >>> (MAX_SHIFT - ONE_SHIFT * i)) & MASK);

            if (t != NONE_TYPE)
                transforms.add(this.newFunctionToken(ctx, t));
        }

        if (transforms.isEmpty() == true)
            throw new IllegalArgumentException("Empty transform pipeline");

        return new Sequence(transforms.toArray(new ByteTransform[transforms.size()]));
    }


    private ByteTransform newFunctionToken(Map<String, Object> ctx, int functionType) {
        switch (functionType) {
        case PRED_TYPE:
            return new PredictiveCoder(ctx);

        case RLE_TYPE:
            return new RLT();

        case DEFLATE_TYPE:
            return new DeflateCodec(ctx);

        default:
            throw new IllegalArgumentException("Unknown transform type: '" + functionType + "'");
        }
    }


    /**
     * Returns the pipeline name of a packed type.
     *
     * @param functionType the packed type
     * @return the pipeline name
     */
    public String getName(long functionType) {
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < 4; i++) {
            final int t = (int) ((functionType >>> (MAX_SHIFT - ONE_SHIFT * i)) & MASK);

            if (t == NONE_TYPE)
                continue;

            if (sb.length() != 0)
                sb.append('+');

            sb.append(getNameToken(t));
        }

        return (sb.length() == 0) ? "NONE" : sb.toString();
    }


    private static String getNameToken(int functionType) {
        switch (functionType) {
        case PRED_TYPE:
            return "PRED";

        case RLE_TYPE:
            return "RLE";

        case DEFLATE_TYPE:
            return "DEFLATE";

        default:
            throw new IllegalArgumentException("Unknown transform type: '" + functionType + "'");
        }
    }
}
