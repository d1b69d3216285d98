package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.validation.Strings;

/**
 * Table and attribute names of the users table.
 *
 * @param table users table name
 * @param emailAttribute email attribute; string or list of strings
 * @param firstNameAttribute first-name attribute; string or list of strings
 * @param idAttribute partition key attribute
 * @param cidAttribute tracking id attribute
 * @param verifiedAttribute boolean verified flag
 * @param unsubscribedAttribute boolean opt-out flag
 * @since 0.1.0
 */
public record UsersSchema(
    String table,
    String emailAttribute,
    String firstNameAttribute,
    String idAttribute,
    String cidAttribute,
    String verifiedAttribute,
    String unsubscribedAttribute) {

  public static final String DEFAULT_TABLE = "CrossStitchUsers";
  public static final String LAST_EMAIL_DATE = "LastEmailDate";

  public UsersSchema {
    table = Strings.requireNonBlank("users.table", table);
    emailAttribute = Strings.requireNonBlank("users.emailAttribute", emailAttribute);
    firstNameAttribute = Strings.requireNonBlank("users.firstNameAttribute", firstNameAttribute);
    idAttribute = Strings.requireNonBlank("users.idAttribute", idAttribute);
    cidAttribute = Strings.requireNonBlank("users.cidAttribute", cidAttribute);
    verifiedAttribute = Strings.requireNonBlank("users.verifiedAttribute", verifiedAttribute);
    unsubscribedAttribute = Strings.requireNonBlank("users.unsubscribedAttribute", unsubscribedAttribute);
  }

  public static UsersSchema defaults() {
    return withTable(DEFAULT_TABLE);
  }

  public static UsersSchema withTable(String table) {
    return new UsersSchema(table, "Email", "FirstName", "ID", "cid", "Verified", "Unsubscribed");
  }
}
