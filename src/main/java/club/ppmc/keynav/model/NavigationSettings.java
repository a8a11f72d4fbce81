/**
 * NavigationSettings.java
 *
 * User-adjustable navigation preferences. Seeded from application.properties by SettingsService and
 * changed at runtime through SettingsController. Kept in memory only.
 * A mutable object so that Jackson can bind it from request bodies.
 */
package club.ppmc.keynav.model;

import lombok.Data;

@Data
public class NavigationSettings {

    /** Append "N of M" to tree announcements. */
    private boolean announcePosition = true;

    /** Append " level N." when the depth differs from the last announced one. */
    private boolean announceLevel = true;

    /**
     * Directory scanned by the file picker. Relative paths resolve against the working directory.
     */
    private String savesRoot = "./saves";

    /** Extension (without dot) of the files listed by the file picker. Empty lists every file. */
    private String savesExtension = "rsc";
}
