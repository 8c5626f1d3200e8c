package nl.bytesoflife.wupframe.parser;

import nl.bytesoflife.wupframe.model.BoyTarget;
import nl.bytesoflife.wupframe.model.PanelLayer;
import nl.bytesoflife.wupframe.model.SheathingPanel;
import nl.bytesoflife.wupframe.model.WallModule;
import nl.bytesoflife.wupframe.model.paf.PafRouting;

/**
 * Context of a single parse call. Never shared between calls.
 */
class ParserState {

    private WallModule module;
    private SheathingPanel panel;
    private PafRouting routing;
    private PathAccumulator path;
    private BoyTarget lastTarget;
    private PanelLayer panelLayer;

    ActiveContext activeContext() {
        return ActiveContext.of(this);
    }

    WallModule getModule() {
        return module;
    }

    void setModule(WallModule module) {
        this.module = module;
    }

    SheathingPanel getPanel() {
        return panel;
    }

    void setPanel(SheathingPanel panel) {
        this.panel = panel;
    }

    void clearPanel() {
        this.panel = null;
    }

    PafRouting getRouting() {
        return routing;
    }

    void setRouting(PafRouting routing) {
        this.routing = routing;
    }

    /**
     * Current path accumulator, created on first use.
     */
    PathAccumulator path() {
        if (path == null) {
            path = new PathAccumulator();
        }
        return path;
    }

    boolean hasPath() {
        return path != null;
    }

    /**
     * Hands over the accumulated path and starts afresh.
     */
    PathAccumulator takePath() {
        PathAccumulator taken = path;
        path = null;
        return taken;
    }

    BoyTarget getLastTarget() {
        return lastTarget;
    }

    void setLastTarget(BoyTarget lastTarget) {
        this.lastTarget = lastTarget;
    }

    PanelLayer getPanelLayer() {
        return panelLayer;
    }

    void setPanelLayer(PanelLayer panelLayer) {
        this.panelLayer = panelLayer;
    }
}
