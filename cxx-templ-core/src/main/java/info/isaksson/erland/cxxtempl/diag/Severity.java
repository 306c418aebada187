package info.isaksson.erland.cxxtempl.diag;

public enum Severity {
    ERROR,
    WARNING,
    /** Template debug trace, recorded only when tracing is enabled. */
    DEBUG
}
