package campus.app;

import campus.Identifier;
import campus.user.Role;
import campus.user.User;
import campus.user.UserRepository;

import java.util.Objects;
import java.util.Optional;

/**
 * Profile, role and avatar changes of existing users.
 */
public final class UserService {
  private final UserRepository users;

  public UserService(UserRepository users) {
    this.users = Objects.requireNonNull(users, "users");
  }

  public void updateProfile(Identifier userId, String firstName, String lastName) {
    Services.run("update user profile", () ->
        users.update(userId, user -> user.updateProfile(firstName, lastName)));
  }

  public void assignRole(Identifier userId, Role role) {
    Services.run("assign user role", () -> users.update(userId, user -> user.assignRole(role)));
  }

  /**
   * @param avatarUrl new URL, or {@code null} to remove the avatar
   */
  public void updateAvatar(Identifier userId, String avatarUrl) {
    Services.run("update user avatar", () -> users.update(userId, user -> user.updateAvatar(avatarUrl)));
  }

  public void removeAvatar(Identifier userId) {
    updateAvatar(userId, null);
  }

  public Optional<User> find(Identifier userId) {
    return users.findById(userId);
  }
}
