package io.b2mash.crmsync.integration.mapping;

import io.b2mash.crmsync.integration.CrmType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Immutable per-CRM field mappings, required fields and payload structures. */
@Component
public class FieldMappingRegistry {

  private static final List<String> EMAIL_ONLY = List.of("email");
  private static final List<String> EMAIL_AND_LAST_NAME = List.of("email", "last_name");

  private final Map<CrmType, CrmFieldMapping> mappings;

  public FieldMappingRegistry() {
    var all = new EnumMap<CrmType, CrmFieldMapping>(CrmType.class);
    register(
        all,
        CrmType.KLAVIYO,
        fields(
            "email", "email",
            "first_name", "first_name",
            "last_name", "last_name",
            "phone", "phone_number",
            "company", "organization",
            "job_title", "title",
            "street_address", "address1",
            "street_address_2", "address2",
            "city", "city",
            "state", "region",
            "postal_code", "zip",
            "country", "country",
            "timezone", "timezone"),
        EMAIL_ONLY,
        StructuralTransformer.attributesProperties(),
        false);
    register(
        all,
        CrmType.SALESFORCE,
        fields(
            "email", "Email",
            "first_name", "FirstName",
            "last_name", "LastName",
            "phone", "Phone",
            "company", "Company",
            "job_title", "Title",
            "department", "Department",
            "street_address", "MailingStreet",
            "city", "MailingCity",
            "state", "MailingState",
            "postal_code", "MailingPostalCode",
            "country", "MailingCountry",
            "website", "Website"),
        EMAIL_AND_LAST_NAME,
        StructuralTransformer.suffixed("__c"),
        true);
    register(
        all,
        CrmType.CREATIO,
        fields(
            "email", "Email",
            "first_name", "GivenName",
            "last_name", "Surname",
            "phone", "MobilePhone",
            "company", "Account",
            "job_title", "JobTitle",
            "department", "Department",
            "street_address", "Address",
            "city", "City",
            "state", "Region",
            "postal_code", "Zip",
            "country", "Country",
            "website", "Web"),
        EMAIL_ONLY,
        StructuralTransformer.flat(),
        false);
    register(
        all,
        CrmType.HUBSPOT,
        fields(
            "email", "email",
            "first_name", "firstname",
            "last_name", "lastname",
            "phone", "phone",
            "company", "company",
            "job_title", "jobtitle",
            "street_address", "address",
            "city", "city",
            "state", "state",
            "postal_code", "zip",
            "country", "country",
            "website", "website"),
        EMAIL_ONLY,
        StructuralTransformer.valueWrapped(),
        false);
    register(
        all,
        CrmType.MAILCHIMP,
        fields(
            "email", "email_address",
            "first_name", "FNAME",
            "last_name", "LNAME",
            "phone", "PHONE",
            "company", "COMPANY",
            "street_address", "ADDRESS.addr1",
            "street_address_2", "ADDRESS.addr2",
            "city", "ADDRESS.city",
            "state", "ADDRESS.state",
            "postal_code", "ADDRESS.zip",
            "country", "ADDRESS.country"),
        EMAIL_ONLY,
        StructuralTransformer.mergeFields("email_address"),
        false);
    register(
        all,
        CrmType.ACTIVECAMPAIGN,
        fields(
            "email", "email",
            "first_name", "firstName",
            "last_name", "lastName",
            "phone", "phone",
            "company", "account",
            "job_title", "jobTitle"),
        EMAIL_ONLY,
        StructuralTransformer.array("fieldValues"),
        false);
    register(
        all,
        CrmType.SENDINBLUE,
        fields(
            "email", "email",
            "first_name", "FIRSTNAME",
            "last_name", "LASTNAME",
            "phone", "SMS",
            "company", "COMPANY"),
        EMAIL_ONLY,
        StructuralTransformer.flat(),
        false);
    register(
        all,
        CrmType.ZOHO,
        fields(
            "email", "Email",
            "first_name", "First_Name",
            "last_name", "Last_Name",
            "phone", "Phone",
            "company", "Company",
            "job_title", "Designation",
            "department", "Department",
            "street_address", "Mailing_Street",
            "city", "Mailing_City",
            "state", "Mailing_State",
            "postal_code", "Mailing_Zip",
            "country", "Mailing_Country",
            "website", "Website"),
        EMAIL_AND_LAST_NAME,
        StructuralTransformer.flat(),
        true);
    register(
        all,
        CrmType.PIPEDRIVE,
        fields(
            "email", "email",
            "first_name", "first_name",
            "last_name", "last_name",
            "phone", "phone",
            "company", "org_name"),
        EMAIL_ONLY,
        StructuralTransformer.flat(),
        false);
    register(
        all,
        CrmType.INTERCOM,
        fields(
            "email", "email",
            "first_name", "name",
            "phone", "phone",
            "company", "company.name",
            "job_title", "custom_attributes.job_title",
            "city", "custom_attributes.city",
            "country", "custom_attributes.country"),
        EMAIL_ONLY,
        StructuralTransformer.nested("custom_attributes"),
        false);
    register(
        all,
        CrmType.CUSTOMERIO,
        fields(
            "email", "email",
            "first_name", "first_name",
            "last_name", "last_name",
            "phone", "phone",
            "company", "company",
            "job_title", "job_title"),
        EMAIL_ONLY,
        StructuralTransformer.flat(),
        false);
    this.mappings = Collections.unmodifiableMap(all);
  }

  public Optional<CrmFieldMapping> find(CrmType crmType) {
    return Optional.ofNullable(mappings.get(crmType));
  }

  /** CRM types with a registered mapping, in declaration order. */
  public List<CrmType> supportedTypes() {
    return List.copyOf(mappings.keySet());
  }

  private static void register(
      Map<CrmType, CrmFieldMapping> target,
      CrmType crmType,
      Map<String, String> fields,
      List<String> requiredFields,
      StructuralTransformer transformer,
      boolean stripPhoneFormatting) {
    target.put(
        crmType,
        new CrmFieldMapping(crmType, fields, requiredFields, transformer, stripPhoneFormatting));
  }

  private static Map<String, String> fields(String... pairs) {
    var fields = new LinkedHashMap<String, String>();
    for (int i = 0; i < pairs.length; i += 2) {
      fields.put(pairs[i], pairs[i + 1]);
    }
    return fields;
  }
}
