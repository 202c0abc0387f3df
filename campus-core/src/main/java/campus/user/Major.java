package campus.user;

import java.util.Optional;

/**
 * Study programme of a student.
 */
public enum Major {
  COMPUTER_SCIENCE("Computer Science"),
  SOFTWARE_ENGINEERING("Software Engineering"),
  MEDIA_TECHNOLOGY("Media Technology"),
  CYBER_SECURITY("Cyber Security"),
  BIG_DATA_ANALYSIS("Big Data Analysis"),
  BIG_DATA_IN_HEALTH("Big Data in Health"),
  IT_MANAGEMENT("IT Management"),
  IT_ENTREPRENEURSHIP("IT Entrepreneurship"),
  ELECTRONIC_ENGINEERING("Electronic Engineering"),
  INTERNET_OF_THINGS("Internet of Things"),
  SMART_TECHNOLOGY("Smart Technology"),
  DIGITAL_JOURNALISM("Digital Journalism"),
  MASTER_OF_COMPUTER_SCIENCE("Master of Computer Science");

  private final String displayName;

  Major(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  public static Optional<Major> fromDisplayName(String displayName) {
    for (Major major : values()) {
      if (major.displayName.equals(displayName)) {
        return Optional.of(major);
      }
    }
    return Optional.empty();
  }
}
