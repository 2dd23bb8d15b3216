package com.example.dutyroster.exception;

/**
 * インスタンスファイルの書式エラー。
 * {@code lineNumber} は1始まり。特定の行に結びつかないエラーでは0。
 */
public class InstanceFormatException extends BusinessException {

    public static final String ERROR_CODE = "INSTANCE_FORMAT_ERROR";

    private final String section;
    private final int lineNumber;

    public InstanceFormatException(String section, int lineNumber, String message) {
        super(ERROR_CODE, format(section, lineNumber, message), section, lineNumber);
        this.section = section;
        this.lineNumber = lineNumber;
    }

    public InstanceFormatException(String section, int lineNumber, String message, Throwable cause) {
        super(ERROR_CODE, format(section, lineNumber, message), cause, section, lineNumber);
        this.section = section;
        this.lineNumber = lineNumber;
    }

    private static String format(String section, int lineNumber, String message) {
        if (section == null) {
            return message;
        }
        return lineNumber > 0
                ? String.format("[%s line %d] %s", section, lineNumber, message)
                : String.format("[%s] %s", section, message);
    }

    public String getSection() {
        return section;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
