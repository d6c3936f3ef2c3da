package org.prevoccupai.oh.data.table;

import java.util.List;

/**
 * Column names shared by extraction, composition and export.
 */
public final class Columns {

    public static final String SUBJECT_ID = "subject_id";
    public static final String WORK_TYPE = "work_type";
    public static final String GROUP = "group";
    public static final String DATE = "date";
    public static final String SESSION = "session";
    public static final String SIDE = "side";
    public static final String WEEKDAY_NUM = "weekday_num";
    public static final String N_SESSION = "n_session";

    /**
     * Key columns two session-level sensor tables are merged on.
     */
    public static final List<String> SESSION_KEYS = List.of(SUBJECT_ID, WORK_TYPE, DATE, SESSION);

    private Columns() {
    }
}
