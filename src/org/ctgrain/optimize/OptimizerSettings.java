package org.ctgrain.optimize;

import org.ctgrain.contact.GuardConfig;
import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.InvalidInputException;

import ij.IJ;
import ij.Prefs;

/**
 * Loads and saves optimiser settings in ImageJ's preferences, so that a
 * session starts with the values used last time.
 */
public class OptimizerSettings {

	static final String TAU_RATIO_KEY = "ctgrain.optimizer.tauRatio";
	static final String CONTACT_MIN_KEY = "ctgrain.optimizer.contactMin";
	static final String CONTACT_MAX_KEY = "ctgrain.optimizer.contactMax";
	static final String SMOOTHING_KEY = "ctgrain.optimizer.smoothingWindow";
	static final String TARGET_CONTACTS_KEY = "ctgrain.optimizer.targetContacts";
	static final String SEED_CONNECTIVITY_KEY = "ctgrain.optimizer.seedConnectivity";
	static final String CONTACT_CONNECTIVITY_KEY = "ctgrain.optimizer.contactConnectivity";
	static final String FLOOD_CONNECTIVITY_KEY = "ctgrain.optimizer.floodConnectivity";
	static final String GUARD_SCALE_KEY = "ctgrain.guard.scale";
	static final String GUARD_FLOOR_KEY = "ctgrain.guard.floorVoxels";
	static final String GUARD_CAP_KEY = "ctgrain.guard.capFraction";
	static final String MAX_RADIUS_KEY = "ctgrain.optimizer.maxRadius";
	static final String MIN_PARTICLES_KEY = "ctgrain.optimizer.minParticles";
	static final String MAX_PARTICLES_KEY = "ctgrain.optimizer.maxParticles";
	static final String TOP_K_KEY = "ctgrain.optimizer.topK";
	static final String KEEP_LABELS_KEY = "ctgrain.optimizer.keepBestLabels";

	/**
	 * Read the settings, falling back to the defaults for missing keys. If
	 * the stored values do not make a valid configuration, the defaults are
	 * returned and a message is logged.
	 */
	public static OptimizerConfig load() {
		final OptimizerConfig d = OptimizerConfig.DEFAULT;
		final SelectionConfig s = d.getSelection();
		final GuardConfig g = d.getGuard();
		try {
			final SelectionConfig selection = new SelectionConfig(Prefs.get(TAU_RATIO_KEY, s.getTauRatio()),
					Prefs.get(CONTACT_MIN_KEY, s.getContactMin()), Prefs.get(CONTACT_MAX_KEY, s.getContactMax()),
					(int) Prefs.get(SMOOTHING_KEY, s.getSmoothingWindow()),
					Prefs.get(TARGET_CONTACTS_KEY, s.getTargetContacts()));
			final GuardConfig guard = new GuardConfig(Prefs.get(GUARD_SCALE_KEY, g.getScale()),
					(int) Prefs.get(GUARD_FLOOR_KEY, g.getFloorVoxels()), Prefs.get(GUARD_CAP_KEY, g.getCapFraction()));
			return new OptimizerConfig.Builder()
					.seedConnectivity(
							Connectivity.of((int) Prefs.get(SEED_CONNECTIVITY_KEY, d.getSeedConnectivity().getNeighbours())))
					.contactConnectivity(Connectivity
							.of((int) Prefs.get(CONTACT_CONNECTIVITY_KEY, d.getContactConnectivity().getNeighbours())))
					.floodConnectivity(Connectivity
							.of((int) Prefs.get(FLOOD_CONNECTIVITY_KEY, d.getFloodConnectivity().getNeighbours())))
					.selection(selection).guard(guard).maxRadius((int) Prefs.get(MAX_RADIUS_KEY, d.getMaxRadius()))
					.expectedParticles((int) Prefs.get(MIN_PARTICLES_KEY, d.getMinParticles()),
							(int) Prefs.get(MAX_PARTICLES_KEY, d.getMaxParticles()))
					.topK((int) Prefs.get(TOP_K_KEY, d.getTopK()))
					.keepBestLabels(Prefs.get(KEEP_LABELS_KEY, d.isKeepBestLabels())).build();
		} catch (final InvalidInputException e) {
			IJ.log("Stored optimiser settings are invalid (" + e.getMessage() + "), using defaults");
			return d;
		}
	}

	/**
	 * Store the settings for the next session
	 */
	public static void save(final OptimizerConfig config) {
		final SelectionConfig s = config.getSelection();
		final GuardConfig g = config.getGuard();
		Prefs.set(TAU_RATIO_KEY, s.getTauRatio());
		Prefs.set(CONTACT_MIN_KEY, s.getContactMin());
		Prefs.set(CONTACT_MAX_KEY, s.getContactMax());
		Prefs.set(SMOOTHING_KEY, s.getSmoothingWindow());
		Prefs.set(TARGET_CONTACTS_KEY, s.getTargetContacts());
		Prefs.set(SEED_CONNECTIVITY_KEY, config.getSeedConnectivity().getNeighbours());
		Prefs.set(CONTACT_CONNECTIVITY_KEY, config.getContactConnectivity().getNeighbours());
		Prefs.set(FLOOD_CONNECTIVITY_KEY, config.getFloodConnectivity().getNeighbours());
		Prefs.set(GUARD_SCALE_KEY, g.getScale());
		Prefs.set(GUARD_FLOOR_KEY, g.getFloorVoxels());
		Prefs.set(GUARD_CAP_KEY, g.getCapFraction());
		Prefs.set(MAX_RADIUS_KEY, config.getMaxRadius());
		Prefs.set(MIN_PARTICLES_KEY, config.getMinParticles());
		Prefs.set(MAX_PARTICLES_KEY, config.getMaxParticles());
		Prefs.set(TOP_K_KEY, config.getTopK());
		Prefs.set(KEEP_LABELS_KEY, config.isKeepBestLabels());
	}
}
