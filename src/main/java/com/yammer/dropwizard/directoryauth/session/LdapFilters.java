package com.yammer.dropwizard.directoryauth.session;

import org.apache.commons.lang3.StringUtils;

public final class LdapFilters {
    public static final String PERSON_FILTER = "(objectclass=person)";

    private LdapFilters() {
    }

    /**
     * {@code (&(objectclass=person)(<attribute>=<value>))} with the value escaped as RFC 4515 requires.
     */
    public static String personWithAttribute(String attribute, String value) {
        return String.format("(&%s(%s=%s))", PERSON_FILTER, attribute, escape(value));
    }

    public static String escape(String value) {
        final StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char ch = value.charAt(i);
            switch (ch) {
                case '\\':
                    escaped.append("\\5c");
                    break;
                case '*':
                    escaped.append("\\2a");
                    break;
                case '(':
                    escaped.append("\\28");
                    break;
                case ')':
                    escaped.append("\\29");
                    break;
                case '\0':
                    escaped.append("\\00");
                    break;
                default:
                    escaped.append(ch);
            }
        }
        return escaped.toString();
    }

    /**
     * Strips the domain from {@code DOMAIN\\user} and {@code user@domain} logon names.
     */
    public static String accountName(String logonName) {
        if (logonName.indexOf('\\') >= 0) {
            return StringUtils.substringAfterLast(logonName, "\\");
        }
        if (logonName.indexOf('@') >= 0) {
            return StringUtils.substringBeforeLast(logonName, "@");
        }
        return logonName;
    }
}
