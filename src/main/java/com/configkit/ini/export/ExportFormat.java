package com.configkit.ini.export;

public enum ExportFormat {
    JSON,
    XML,
    CSV
}
