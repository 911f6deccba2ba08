package com.sceneanchor.domain.anchor.model;

/**
 * A tracked span as handed over by the segmentation stage.
 *
 * @param id          stable span identifier
 * @param parentId    identifier of the enclosing unit (e.g. chapter), nullable
 * @param startOffset start position in the full document
 * @param endOffset   end position (exclusive) in the full document
 * @param text        the exact span text, nullable (the document slice is authoritative)
 */
public record SceneSpan(
        String id,
        String parentId,
        int startOffset,
        int endOffset,
        String text
) {
    public int length() {
        return endOffset - startOffset;
    }
}
