package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.WupModel;

/**
 * The one reference through which the rest of an application sees the current model.
 * Edits build a new model and swap it in; a model obtained from {@link #get()} is never
 * changed afterwards by the editor.
 */
public class ModelHandle {

    private WupModel model;
    private int generation;

    public ModelHandle(WupModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Model must not be null");
        }
        this.model = model;
    }

    public WupModel get() {
        return model;
    }

    /**
     * Number of swaps so far; 0 for the model the handle was created with.
     */
    public int getGeneration() {
        return generation;
    }

    WupModel swap(WupModel next) {
        WupModel previous = model;
        model = next;
        generation++;
        return previous;
    }
}
