package org.codeforiati.stats.domain.reference;

/** Names of the codelists consulted by statistics. */
public final class Codelists {
  public static final String VERSION = "Version";
  public static final String ACTIVITY_STATUS = "ActivityStatus";
  public static final String CURRENCY = "Currency";
  public static final String SECTOR = "Sector";
  public static final String SECTOR_CATEGORY = "SectorCategory";
  public static final String DOCUMENT_CATEGORY = "DocumentCategory";
  public static final String AID_TYPE = "AidType";
  public static final String BUDGET_NOT_PROVIDED = "BudgetNotProvided";
  public static final String ORGANISATION_REGISTRATION_AGENCY = "OrganisationRegistrationAgency";
  public static final String CRS_CHANNEL_CODE = "CRSChannelCode";

  private Codelists() {
    // Constants
  }
}
