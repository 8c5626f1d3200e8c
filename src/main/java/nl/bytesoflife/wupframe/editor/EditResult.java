package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.WupModel;

/**
 * Outcome of an edit. {@code model} is the model now held by the handle: the new snapshot when
 * applied, the untouched current one otherwise.
 */
public record EditResult(boolean applied, int affected, WupModel model, String message) {

    static EditResult applied(int affected, WupModel model, String message) {
        return new EditResult(true, affected, model, message);
    }

    static EditResult noOp(WupModel model, String message) {
        return new EditResult(false, 0, model, message);
    }
}
