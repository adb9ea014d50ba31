package io.campaign;

/**
 * Thrown when a referenced campaign, recipient or group does not exist.
 */
public final class NotFoundException extends CampaignException {
  private final String resourceType;
  private final Object resourceId;

  public NotFoundException(String resourceType, Object resourceId) {
    super(resourceType + " not found: " + resourceId);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String resourceType() {
    return resourceType;
  }

  public Object resourceId() {
    return resourceId;
  }
}
