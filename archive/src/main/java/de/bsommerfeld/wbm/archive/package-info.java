/**
 * Content-addressed archive of captured pages.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [wbm command line]
 *        │
 *        ▼
 *   ArchiveStore        ← create / open / extract / list / verify / ingest
 *    ┌───┴──────────┐
 *    │              │
 *  ShardWalker   DigestVerifier   ← lazy tree walk, parallel re-hashing
 *    │              │
 *    └──────┬───────┘
 *           ▼
 *   digest.Digests      ← SHA-1 of (inflated) content
 * </pre>
 *
 * <h2>On-disk layout</h2>
 *
 * <pre>
 * &lt;root&gt;/
 *   00/
 *   01/
 *   ...
 *   3f/
 *     a9c2...e1.gz     ← digest "3fa9c2...e1", gzip of the captured bytes
 *   ...
 *   ff/
 * </pre>
 *
 * The digest is always computed over the <em>inflated</em> bytes, so an entry
 * can be re-verified at any time with {@link de.bsommerfeld.wbm.archive.ArchiveStore#computeDigests}.
 *
 * <h2>Error model</h2>
 * Single-entry operations throw {@link de.bsommerfeld.wbm.archive.ArchiveException}.
 * Bulk operations return one {@link de.bsommerfeld.wbm.archive.Outcome} per
 * entry so that one broken file never aborts a walk. A digest that does not
 * match its content is a finding, reported as data
 * ({@link de.bsommerfeld.wbm.archive.DigestPair#isValid()},
 * {@link de.bsommerfeld.wbm.archive.FileLocation.Mismatch}).
 */
package de.bsommerfeld.wbm.archive;
