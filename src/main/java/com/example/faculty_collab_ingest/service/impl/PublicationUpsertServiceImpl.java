package com.example.faculty_collab_ingest.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.example.faculty_collab_ingest.dto.AuthorClassification;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.ParsedPublication;
import com.example.faculty_collab_ingest.mapper.AuthorMapper;
import com.example.faculty_collab_ingest.mapper.CollaborationMapper;
import com.example.faculty_collab_ingest.mapper.PublicationAuthorMapper;
import com.example.faculty_collab_ingest.mapper.PublicationMapper;
import com.example.faculty_collab_ingest.mapper.PublicationSourceMapper;
import com.example.faculty_collab_ingest.mapper.VenueMapper;
import com.example.faculty_collab_ingest.model.Author;
import com.example.faculty_collab_ingest.model.Collaboration;
import com.example.faculty_collab_ingest.model.Publication;
import com.example.faculty_collab_ingest.model.PublicationAuthor;
import com.example.faculty_collab_ingest.model.PublicationSource;
import com.example.faculty_collab_ingest.model.Venue;
import com.example.faculty_collab_ingest.service.IdentityResolver;
import com.example.faculty_collab_ingest.service.PublicationUpsertService;
import com.example.faculty_collab_ingest.util.NameNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;

/**
 * 论文记录入库实现。
 * 同一 dblpKey（或相同 DOI）的记录只保留一条论文，来源 PID 集合取并集；
 * 已存在论文的属性不会被覆盖，重复导入不改变任何计数。
 */
@Slf4j
@Service
public class PublicationUpsertServiceImpl implements PublicationUpsertService {

    @Autowired
    private PublicationMapper publicationMapper;

    @Autowired
    private PublicationSourceMapper publicationSourceMapper;

    @Autowired
    private PublicationAuthorMapper publicationAuthorMapper;

    @Autowired
    private AuthorMapper authorMapper;

    @Autowired
    private VenueMapper venueMapper;

    @Autowired
    private CollaborationMapper collaborationMapper;

    @Autowired
    private IdentityResolver identityResolver;

    @Override
    public void upsert(ParsedPublication record, FacultyRoster roster, IngestionStats stats) {
        if (record.getDblpKey() == null || record.getDblpKey().isBlank()) {
            throw new IllegalArgumentException("Publication record without key");
        }

        // 1. 按键查找，其次按 DOI 查找
        Publication publication = findExisting(record);
        boolean created = publication == null;
        boolean wasFaculty = !created && Boolean.TRUE.equals(publication.getHasFacultyAuthor());
        if (created) {
            Venue venue = getOrCreateVenue(record, stats);
            publication = toEntity(record, venue);
            publicationMapper.insert(publication);
            stats.setPublicationsAdded(stats.getPublicationsAdded() + 1);
        } else {
            stats.setPublicationsSkipped(stats.getPublicationsSkipped() + 1);
            if (!publication.getDblpKey().equals(record.getDblpKey())) {
                log.info("论文 {} 与已存在的 {} DOI 相同，合并来源", record.getDblpKey(), publication.getDblpKey());
            }
        }

        // 2. 来源 PID 集合只增不减
        Set<String> sources = linkSource(publication.getId(), record.getSourcePid(), stats);

        // 3. 作者与署名关系，身份判定基于合并后的来源集合
        Map<Long, Integer> links = loadAuthorLinks(publication.getId());
        Set<Long> newlyLinked = new LinkedHashSet<>();
        boolean facultyLinked = false;
        for (AuthorClassification classification : identityResolver.classify(sources, record.getAuthors(), roster)) {
            if (classification.getNormalizedName().isEmpty()) {
                continue;
            }
            Author author = getOrCreateAuthor(classification, stats);
            facultyLinked |= author.isFacultyMember();
            if (links.containsKey(author.getId())) {
                // 同一记录中重复的名字，或之前的来源已经关联过
                continue;
            }
            PublicationAuthor link = new PublicationAuthor();
            link.setPublicationId(publication.getId());
            link.setAuthorId(author.getId());
            link.setAuthorPosition(classification.getPosition());
            publicationAuthorMapper.insert(link);
            links.put(author.getId(), classification.getPosition());
            newlyLinked.add(author.getId());
        }

        // 4. 只为至少一方是新关联的作者对计数，保证合作次数等于共同论文数
        if (!newlyLinked.isEmpty()) {
            List<Long> authorIds = new ArrayList<>(links.keySet());
            Collections.sort(authorIds);
            for (int i = 0; i < authorIds.size(); i++) {
                for (int j = i + 1; j < authorIds.size(); j++) {
                    Long a1 = authorIds.get(i);
                    Long a2 = authorIds.get(j);
                    if (newlyLinked.contains(a1) || newlyLinked.contains(a2)) {
                        recordCollaboration(a1, a2, publication.getYear(), stats);
                    }
                }
            }
        }

        // 5. 教师标记只会由 false 变为 true
        boolean hasFaculty = wasFaculty || facultyLinked || roster.containsAnyPid(sources);
        if (publication.getVenueId() != null) {
            UpdateWrapper<Venue> venueUpdate = new UpdateWrapper<>();
            if (created) {
                venueUpdate.setSql("total_publications = total_publications + 1");
            }
            if (hasFaculty && !wasFaculty) {
                venueUpdate.setSql("faculty_publications = faculty_publications + 1");
            }
            if (created || (hasFaculty && !wasFaculty)) {
                venueUpdate.set("updated_at", LocalDateTime.now()).eq("id", publication.getVenueId());
                venueMapper.update(null, venueUpdate);
            }
        }

        Publication update = new Publication();
        update.setId(publication.getId());
        update.setHasFacultyAuthor(hasFaculty);
        update.setAuthorCount(links.size());
        update.setUpdatedAt(LocalDateTime.now());
        publicationMapper.updateById(update);
    }

    private Publication findExisting(ParsedPublication record) {
        Publication existing = publicationMapper.selectOne(new QueryWrapper<Publication>()
                .eq("dblp_key", record.getDblpKey()));
        if (existing == null && record.getDoi() != null) {
            existing = publicationMapper.selectOne(new QueryWrapper<Publication>()
                    .eq("doi", record.getDoi())
                    .orderByAsc("id")
                    .last("LIMIT 1"));
        }
        return existing;
    }

    private Set<String> linkSource(Long publicationId, String sourcePid, IngestionStats stats) {
        Set<String> sources = new LinkedHashSet<>();
        for (PublicationSource row : publicationSourceMapper.selectList(new QueryWrapper<PublicationSource>()
                .eq("publication_id", publicationId)
                .orderByAsc("id"))) {
            sources.add(row.getSourcePid());
        }
        if (sourcePid != null && !sources.contains(sourcePid)) {
            PublicationSource row = new PublicationSource();
            row.setPublicationId(publicationId);
            row.setSourcePid(sourcePid);
            publicationSourceMapper.insert(row);
            sources.add(sourcePid);
            stats.setSourceLinksAdded(stats.getSourceLinksAdded() + 1);
        }
        return sources;
    }

    private Map<Long, Integer> loadAuthorLinks(Long publicationId) {
        Map<Long, Integer> links = new LinkedHashMap<>();
        for (PublicationAuthor link : publicationAuthorMapper.selectList(new QueryWrapper<PublicationAuthor>()
                .eq("publication_id", publicationId)
                .orderByAsc("author_position"))) {
            links.put(link.getAuthorId(), link.getAuthorPosition());
        }
        return links;
    }

    private Author getOrCreateAuthor(AuthorClassification classification, IngestionStats stats) {
        Author author = authorMapper.selectOne(new QueryWrapper<Author>()
                .eq("normalized_name", classification.getNormalizedName()));
        FacultyMember member = classification.getMember();
        if (author == null) {
            author = new Author();
            author.setName(classification.getAuthorName().trim());
            author.setNormalizedName(classification.getNormalizedName());
            author.setIsFaculty(member != null);
            if (member != null) {
                fillFacultyFields(author, member);
            }
            authorMapper.insert(author);
            stats.setAuthorsAdded(stats.getAuthorsAdded() + 1);
            return author;
        }
        if (member != null && upgradeToFaculty(author, member)) {
            author.setUpdatedAt(LocalDateTime.now());
            authorMapper.updateById(author);
            stats.setAuthorsUpgraded(stats.getAuthorsUpgraded() + 1);
            log.debug("作者 {} 补充教师信息 (pid={})", author.getName(), member.getPrimaryPid());
        }
        return author;
    }

    /**
     * 只填充空字段，已有的值不会被覆盖，也不会降级
     */
    private boolean upgradeToFaculty(Author author, FacultyMember member) {
        boolean changed = false;
        if (!author.isFacultyMember()) {
            author.setIsFaculty(true);
            changed = true;
        }
        if (author.getDblpPid() == null) {
            author.setDblpPid(member.getPrimaryPid());
            changed = true;
        }
        if (author.getEmail() == null && member.getEmail() != null) {
            author.setEmail(member.getEmail());
            changed = true;
        }
        if (author.getPhone() == null && member.getPhone() != null) {
            author.setPhone(member.getPhone());
            changed = true;
        }
        if (author.getDesignation() == null && member.getDesignation() != null) {
            author.setDesignation(member.getDesignation());
            changed = true;
        }
        if (author.getDepartment() == null && member.getDepartment() != null) {
            author.setDepartment(member.getDepartment());
            changed = true;
        }
        if (author.getHindex() == null && member.getHindex() != null) {
            author.setHindex(member.getHindex());
            changed = true;
        }
        return changed;
    }

    private void fillFacultyFields(Author author, FacultyMember member) {
        author.setDblpPid(member.getPrimaryPid());
        author.setEmail(member.getEmail());
        author.setPhone(member.getPhone());
        author.setDesignation(member.getDesignation());
        author.setDepartment(member.getDepartment());
        author.setHindex(member.getHindex());
    }

    private Venue getOrCreateVenue(ParsedPublication record, IngestionStats stats) {
        if (record.getVenueName() == null || record.getVenueName().isBlank()) {
            return null;
        }
        String normalized = NameNormalizer.normalizeVenue(record.getVenueName());
        Venue venue = venueMapper.selectOne(new QueryWrapper<Venue>()
                .eq("normalized_name", normalized)
                .eq("venue_type", record.getVenueType()));
        if (venue == null) {
            venue = new Venue();
            venue.setName(record.getVenueName().replaceAll("\\s+", " ").trim());
            venue.setNormalizedName(normalized);
            venue.setVenueType(record.getVenueType());
            venue.setPublisher(record.getPublisher());
            venue.setTotalPublications(0);
            venue.setFacultyPublications(0);
            venueMapper.insert(venue);
            stats.setVenuesAdded(stats.getVenuesAdded() + 1);
        }
        return venue;
    }

    private void recordCollaboration(Long author1Id, Long author2Id, Integer year, IngestionStats stats) {
        Collaboration collaboration = collaborationMapper.selectOne(new QueryWrapper<Collaboration>()
                .eq("author1_id", author1Id)
                .eq("author2_id", author2Id));
        if (collaboration == null) {
            collaboration = new Collaboration();
            collaboration.setAuthor1Id(author1Id);
            collaboration.setAuthor2Id(author2Id);
            collaboration.setCollaborationCount(1);
            collaboration.setFirstCollaborationYear(year);
            collaboration.setLastCollaborationYear(year);
            collaborationMapper.insert(collaboration);
            stats.setCollaborationsAdded(stats.getCollaborationsAdded() + 1);
            return;
        }
        collaboration.setCollaborationCount(collaboration.getCollaborationCount() + 1);
        if (year != null) {
            if (collaboration.getFirstCollaborationYear() == null || year < collaboration.getFirstCollaborationYear()) {
                collaboration.setFirstCollaborationYear(year);
            }
            if (collaboration.getLastCollaborationYear() == null || year > collaboration.getLastCollaborationYear()) {
                collaboration.setLastCollaborationYear(year);
            }
        }
        collaboration.setUpdatedAt(LocalDateTime.now());
        collaborationMapper.updateById(collaboration);
    }

    private Publication toEntity(ParsedPublication record, Venue venue) {
        Publication publication = new Publication();
        publication.setDblpKey(record.getDblpKey());
        publication.setDoi(record.getDoi());
        publication.setTitle(record.getTitle() == null ? "" : record.getTitle());
        publication.setNormalizedTitle(record.getNormalizedTitle());
        publication.setPublicationType(record.getPublicationType());
        publication.setYear(record.getYear());
        publication.setVenueId(venue == null ? null : venue.getId());
        publication.setJournal(record.getJournal());
        publication.setBooktitle(record.getBooktitle());
        publication.setVolume(record.getVolume());
        publication.setNumber(record.getNumber());
        publication.setPages(record.getPages());
        publication.setPublisher(record.getPublisher());
        publication.setSeries(record.getSeries());
        publication.setEditor(record.getEditors().isEmpty() ? null : String.join(", ", record.getEditors()));
        publication.setUrl(record.getUrl());
        publication.setEe(record.getEe());
        publication.setBiburl(record.getBiburl());
        publication.setBibsource(record.getBibsource());
        publication.setAbstractText(record.getAbstractText());
        publication.setKeywords(record.getKeywords());
        publication.setAuthorCount(0);
        publication.setHasFacultyAuthor(false);
        publication.setSourcePid(record.getSourcePid());
        return publication;
    }
}
