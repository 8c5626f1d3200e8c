package nl.bytesoflife.wupframe.parser;

/**
 * Owner of the next {@code PP} statement. An open sheathing panel wins over an open routing.
 */
public enum ActiveContext {
    PANEL,
    ROUTING,
    NONE;

    static ActiveContext of(ParserState state) {
        if (state.getPanel() != null) return PANEL;
        if (state.getRouting() != null) return ROUTING;
        return NONE;
    }
}
