package com.enterprise.rds.spring;

import com.enterprise.rds.sql.param.SqlEscaper;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code rds.operator.*} settings:
 * <pre>
 * rds.operator.time-zone=+08:00
 * rds.operator.stringify-objects=false
 * </pre>
 */
@ConfigurationProperties(prefix = "rds.operator")
public class OperatorProperties {

    /** Zone for date literals: local, Z, an offset such as +08:00, or a zone id. */
    private String timeZone = SqlEscaper.LOCAL_TIME_ZONE;

    /** Render maps and unknown objects as quoted strings in format() and escape(). */
    private boolean stringifyObjects = false;

    public String getTimeZone() { return timeZone; }
    public void setTimeZone(String timeZone) { this.timeZone = timeZone; }

    public boolean isStringifyObjects() { return stringifyObjects; }
    public void setStringifyObjects(boolean stringifyObjects) { this.stringifyObjects = stringifyObjects; }
}
