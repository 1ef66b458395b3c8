package com.example.authclient.domain.entity;

/**
 * What the user is trying to do in the interactive flow: log in, register, or create an organization.
 * Empty strings mean "not requested" and are never transmitted.
 */
public record AuthorizationIntent(
    boolean signUp,
    boolean createOrg,
    String orgCode,
    String orgName,
    String loginHint,
    String planInterest,
    String pricingTableKey,
    boolean usePkce,
    boolean useNonce
) {

  public AuthorizationIntent {
    orgCode = nullToEmpty(orgCode);
    orgName = nullToEmpty(orgName);
    loginHint = nullToEmpty(loginHint);
    planInterest = nullToEmpty(planInterest);
    pricingTableKey = nullToEmpty(pricingTableKey);
  }

  public static AuthorizationIntent login(String orgCode, String loginHint) {
    return new AuthorizationIntent(false, false, orgCode, "", loginHint, "", "", true, false);
  }

  public static AuthorizationIntent register(String orgCode, String loginHint,
                                             String planInterest, String pricingTableKey) {
    return new AuthorizationIntent(true, false, orgCode, "", loginHint, planInterest, pricingTableKey, true, false);
  }

  public static AuthorizationIntent createOrg(String orgName) {
    return new AuthorizationIntent(true, true, "", orgName, "", "", "", true, false);
  }

  /**
   * Opt into ID-token replay binding. Off by default.
   */
  public AuthorizationIntent withNonce() {
    return new AuthorizationIntent(signUp, createOrg, orgCode, orgName, loginHint,
                                   planInterest, pricingTableKey, usePkce, true);
  }

  public AuthorizationIntent withoutPkce() {
    return new AuthorizationIntent(signUp, createOrg, orgCode, orgName, loginHint,
                                   planInterest, pricingTableKey, false, useNonce);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
